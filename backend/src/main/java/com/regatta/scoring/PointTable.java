package com.regatta.scoring;

import java.util.Map;
import java.util.TreeMap;

/**
 * Points per finish position, capped at {@code maxScoringPosition}
 * (0 leaves the cap to the table itself).
 */
public record PointTable(
        Map<Integer, Integer> points,
        int maxScoringPosition
) {

    public static final Map<Integer, Integer> DEFAULT_POINTS = Map.of(
            1, 20,
            2, 12,
            3, 8,
            4, 6,
            5, 4,
            6, 3,
            7, 2,
            8, 1
    );

    public static final int DEFAULT_MAX_SCORING_POSITION = 8;

    public static final PointTable DEFAULT = new PointTable(DEFAULT_POINTS, DEFAULT_MAX_SCORING_POSITION);

    public PointTable {
        points = points == null || points.isEmpty()
                ? DEFAULT_POINTS
                : Map.copyOf(new TreeMap<>(points));
    }

    public int pointsFor(Integer position) {
        return ScoringPolicy.pointsForPosition(points, maxScoringPosition, position);
    }

    public int winnerPoints() {
        return pointsFor(1);
    }
}
