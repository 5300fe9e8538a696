package com.regatta.ranking;

import java.util.List;

public record RankingGroup(
        GroupMetadata metadata,
        List<RankingEntry> entries
) {
}
