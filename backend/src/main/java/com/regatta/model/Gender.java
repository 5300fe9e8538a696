package com.regatta.model;

public enum Gender {
    M,
    F,
    MIXED
}
