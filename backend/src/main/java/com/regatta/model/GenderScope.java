package com.regatta.model;

/**
 * Which athletes a category admits.
 */
public enum GenderScope {
    MEN,
    WOMEN,
    MIXED;

    public boolean admits(Gender gender) {
        return switch (this) {
            case MEN -> gender == Gender.M;
            case WOMEN -> gender == Gender.F;
            case MIXED -> true;
        };
    }

    public Gender toEventGender() {
        return switch (this) {
            case MEN -> Gender.M;
            case WOMEN -> Gender.F;
            case MIXED -> Gender.MIXED;
        };
    }
}
