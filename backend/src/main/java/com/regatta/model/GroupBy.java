package com.regatta.model;

public enum GroupBy {
    GENDER,
    CATEGORY,
    CATEGORY_GENDER
}
