package com.regatta.model;

public enum Discipline {
    CLASSIC,
    COASTAL,
    BEACH,
    INDOOR
}
