package com.regatta.scoring;

/**
 * A lane in finish order. {@code position} is null for non-finishers that
 * were not placed.
 */
public record PlacedLane(
        LaneOutcome lane,
        Integer position
) {

    public boolean isPlaced() {
        return position != null;
    }
}
