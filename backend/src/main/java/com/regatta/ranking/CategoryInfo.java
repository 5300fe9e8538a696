package com.regatta.ranking;

import com.regatta.model.LocalizedTitle;

import java.util.UUID;

public record CategoryInfo(
        UUID categoryId,
        String code,
        LocalizedTitle titles,
        boolean masters
) {
}
