package com.regatta.scoring;

public record MedalTally(
        int gold,
        int silver,
        int bronze,
        int total
) {

    public static final MedalTally EMPTY = new MedalTally(0, 0, 0, 0);

    public static MedalTally of(int gold, int silver, int bronze) {
        return new MedalTally(gold, silver, bronze, gold + silver + bronze);
    }

    public MedalTally plus(MedalTally other) {
        return of(gold + other.gold, silver + other.silver, bronze + other.bronze);
    }
}
