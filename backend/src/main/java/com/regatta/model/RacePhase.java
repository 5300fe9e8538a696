package com.regatta.model;

import java.util.List;

/**
 * Knockout phases in progression order. {@link #FINAL_B} is raced alongside
 * {@link #FINAL_A}, which closes the event.
 */
public enum RacePhase {
    TIME_TRIAL("TT", "Time Trial"),
    REPECHAGE("REP", "Repechage"),
    QUARTERFINAL("QF", "Quarterfinal"),
    SEMIFINAL("SF", "Semifinal"),
    FINAL_B("FB", "Final B"),
    FINAL_A("FA", "Final A");

    public static final List<RacePhase> KNOCKOUT_PHASES = List.of(REPECHAGE, QUARTERFINAL, SEMIFINAL);
    public static final List<RacePhase> FINAL_PHASES = List.of(FINAL_B, FINAL_A);

    private final String codePrefix;
    private final String displayName;

    RacePhase(String codePrefix, String displayName) {
        this.codePrefix = codePrefix;
        this.displayName = displayName;
    }

    public String getCodePrefix() {
        return codePrefix;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isFinal() {
        return FINAL_PHASES.contains(this);
    }

    public boolean isBefore(RacePhase other) {
        return ordinal() < other.ordinal();
    }

    public String raceCode(int heatNumber) {
        return isFinal() ? codePrefix : codePrefix + heatNumber;
    }
}
