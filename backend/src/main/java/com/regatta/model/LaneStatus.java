package com.regatta.model;

/**
 * Outcome of one lane. Only {@link #OK} carries a finish time.
 */
public enum LaneStatus {
    OK,
    DNS,
    DNF,
    DSQ;

    public boolean isFinisher() {
        return this == OK;
    }
}
