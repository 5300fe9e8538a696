package com.regatta.scoring;

import com.regatta.model.LaneStatus;
import com.regatta.web.DataInconsistencyException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Point table lookups, finish order and medal counting shared by rankings and
 * bracket progression.
 */
public final class ScoringPolicy {

    private static final Comparator<LaneOutcome> BY_TIME_THEN_LANE = Comparator
            .comparingLong((LaneOutcome lane) -> lane.elapsedMs())
            .thenComparingInt(LaneOutcome::laneNumber);

    private ScoringPolicy() {
    }

    public static int pointsForPosition(Map<Integer, Integer> table, int maxScoringPosition, Integer position) {
        if (position == null || position < 1) {
            return 0;
        }
        if (maxScoringPosition > 0 && position > maxScoringPosition) {
            return 0;
        }
        Integer points = table.get(position);
        return points == null ? 0 : points;
    }

    /**
     * Orders the lanes of one race. Finishers are sorted by time and share a
     * position on equal times (1, 1, 3). Non-finishers follow in lane order and
     * stay unplaced, unless {@code placeNonFinishers} is set and fewer than
     * {@code laneCapacity} lanes finished: each then takes the next free position.
     */
    public static List<PlacedLane> resolveFinishOrder(
            Collection<LaneOutcome> lanes,
            int laneCapacity,
            boolean placeNonFinishers
    ) {
        List<LaneOutcome> finishers = new ArrayList<>();
        List<LaneOutcome> nonFinishers = new ArrayList<>();
        for (LaneOutcome lane : lanes) {
            if (lane.status() == null) {
                throw new DataInconsistencyException("Lane " + lane.laneNumber() + " has no result status");
            }
            if (lane.status() == LaneStatus.OK) {
                if (lane.elapsedMs() == null) {
                    throw new DataInconsistencyException("Lane " + lane.laneNumber() + " finished without a time");
                }
                finishers.add(lane);
            } else {
                nonFinishers.add(lane);
            }
        }
        finishers.sort(BY_TIME_THEN_LANE);
        nonFinishers.sort(Comparator.comparingInt(LaneOutcome::laneNumber));

        List<PlacedLane> order = new ArrayList<>(lanes.size());
        for (int i = 0; i < finishers.size(); i++) {
            LaneOutcome lane = finishers.get(i);
            if (i > 0 && lane.elapsedMs().equals(finishers.get(i - 1).elapsedMs())) {
                order.add(new PlacedLane(lane, order.get(i - 1).position()));
            } else {
                order.add(new PlacedLane(lane, i + 1));
            }
        }

        boolean placeRest = placeNonFinishers && finishers.size() < laneCapacity;
        int nextPosition = finishers.size() + 1;
        for (LaneOutcome lane : nonFinishers) {
            order.add(new PlacedLane(lane, placeRest ? nextPosition++ : null));
        }
        return order;
    }

    public static MedalTally tallyMedals(Collection<Integer> ranks) {
        int gold = 0;
        int silver = 0;
        int bronze = 0;
        for (Integer rank : ranks) {
            if (rank == null) {
                continue;
            }
            switch (rank) {
                case 1 -> gold++;
                case 2 -> silver++;
                case 3 -> bronze++;
                default -> {
                }
            }
        }
        return MedalTally.of(gold, silver, bronze);
    }
}
