package com.regatta.ranking;

import java.util.ArrayList;
import java.util.List;

public record RankingView(
        RankingLayout layout,
        List<String> columns
) {

    public static RankingView of(RankingLayout layout, List<StageInfo> stages) {
        if (layout != RankingLayout.ATHLETE_MULTI_STAGE) {
            return new RankingView(layout, layout.getBaseColumns());
        }
        List<String> columns = new ArrayList<>(layout.getBaseColumns());
        int totalAt = columns.size() - 1;
        for (StageInfo stage : stages) {
            columns.add(totalAt++, "stage:" + stage.stageIndex());
        }
        return new RankingView(layout, List.copyOf(columns));
    }
}
