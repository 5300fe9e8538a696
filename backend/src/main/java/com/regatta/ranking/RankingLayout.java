package com.regatta.ranking;

import java.util.List;

/**
 * How a ranking result is meant to be laid out. Stage columns of
 * {@link #ATHLETE_MULTI_STAGE} are appended per stage.
 */
public enum RankingLayout {
    ATHLETE_SINGLE_STAGE(List.of("rank", "athlete", "club", "positions", "points")),
    ATHLETE_MULTI_STAGE(List.of("rank", "athlete", "club", "points")),
    CLUB_POINTS(List.of("rank", "club", "races", "positions", "points")),
    CLUB_MEDALS(List.of("rank", "club", "gold", "silver", "bronze", "total"));

    private final List<String> baseColumns;

    RankingLayout(List<String> baseColumns) {
        this.baseColumns = baseColumns;
    }

    public List<String> getBaseColumns() {
        return baseColumns;
    }
}
