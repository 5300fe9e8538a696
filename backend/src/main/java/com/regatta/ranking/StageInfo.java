package com.regatta.ranking;

public record StageInfo(
        int stageIndex,
        String label,
        boolean finalDay
) {
}
