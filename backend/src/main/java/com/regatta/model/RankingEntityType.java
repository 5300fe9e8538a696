package com.regatta.model;

public enum RankingEntityType {
    ATHLETE,
    CLUB
}
