package com.regatta.model;

public enum JourneyMode {
    ALL,
    FINAL_ONLY,
    BEST_N
}
