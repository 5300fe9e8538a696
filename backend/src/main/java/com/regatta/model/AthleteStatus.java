package com.regatta.model;

public enum AthleteStatus {
    ACTIVE,
    SUSPENDED,
    INACTIVE
}
