package com.regatta.model;

public enum MedalType {
    GOLD,
    SILVER,
    BRONZE
}
