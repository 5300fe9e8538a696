package com.regatta.model;

public enum SeedingRule {
    SUBMISSION_ORDER,
    SEED
}
