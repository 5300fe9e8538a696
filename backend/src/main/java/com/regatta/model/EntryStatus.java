package com.regatta.model;

public enum EntryStatus {
    PENDING,
    APPROVED,
    REJECTED
}
