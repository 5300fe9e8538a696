package com.regatta.ranking;

import com.regatta.model.Gender;
import com.regatta.model.LocalizedTitle;

import java.util.UUID;

/**
 * Labels of one ranking group. Category fields are null when grouping by gender only.
 */
public record GroupMetadata(
        String groupKey,
        Gender gender,
        UUID categoryId,
        String categoryCode,
        LocalizedTitle titles
) {
}
