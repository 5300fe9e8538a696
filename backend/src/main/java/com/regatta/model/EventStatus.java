package com.regatta.model;

public enum EventStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED
}
