package com.regatta.model;

public enum ScoringMode {
    POINTS,
    MEDALS
}
