package com.regatta.model;

public enum RaceStatus {
    SCHEDULED,
    COMPLETED,
    CANCELLED
}
