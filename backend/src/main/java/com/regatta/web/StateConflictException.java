package com.regatta.web;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * The target is not in a state that allows the operation. Callers decide
 * between waiting (phase not ready) and recognising a duplicate action.
 */
public class StateConflictException extends RegattaException {

    public static final String ALREADY_PROCESSED = "already_processed";
    public static final String PHASE_NOT_READY = "phase_not_ready";
    public static final String PHASE_NOT_APPLICABLE = "phase_not_applicable";
    public static final String EVENT_COMPLETED = "event_completed";
    public static final String EVENT_NOT_STARTED = "event_not_started";
    public static final String RACE_COMPLETED = "race_completed";
    public static final String RACE_NOT_COMPLETED = "race_not_completed";
    public static final String DOWNSTREAM_RACES_EXIST = "downstream_races_exist";
    public static final String DUPLICATE_EVENT = "duplicate_event";
    public static final String DUPLICATE_CODE = "duplicate_code";
    public static final String PRESET_PROTECTED = "preset_protected";

    public StateConflictException(String code, String message) {
        super(HttpStatus.CONFLICT, code, message, List.of());
    }

    public static StateConflictException alreadyProcessed(String detail) {
        return new StateConflictException(ALREADY_PROCESSED, detail);
    }

    public static StateConflictException phaseNotReady(String detail) {
        return new StateConflictException(PHASE_NOT_READY, detail);
    }

    public static StateConflictException phaseNotApplicable(String detail) {
        return new StateConflictException(PHASE_NOT_APPLICABLE, detail);
    }

    public static StateConflictException eventCompleted(String detail) {
        return new StateConflictException(EVENT_COMPLETED, detail);
    }

    public static StateConflictException eventNotStarted(String detail) {
        return new StateConflictException(EVENT_NOT_STARTED, detail);
    }

    public static StateConflictException raceCompleted(String detail) {
        return new StateConflictException(RACE_COMPLETED, detail);
    }

    public static StateConflictException raceNotCompleted(String detail) {
        return new StateConflictException(RACE_NOT_COMPLETED, detail);
    }

    public static StateConflictException downstreamRacesExist(String detail) {
        return new StateConflictException(DOWNSTREAM_RACES_EXIST, detail);
    }

    public static StateConflictException duplicateEvent(String detail) {
        return new StateConflictException(DUPLICATE_EVENT, detail);
    }

    public static StateConflictException duplicateCode(String detail) {
        return new StateConflictException(DUPLICATE_CODE, detail);
    }

    public static StateConflictException presetProtected(String detail) {
        return new StateConflictException(PRESET_PROTECTED, detail);
    }
}
