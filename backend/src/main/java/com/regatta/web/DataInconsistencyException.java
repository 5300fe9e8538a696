package com.regatta.web;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Stored data contradicts itself. The computation that found it is abandoned
 * rather than returning a partial answer.
 */
public class DataInconsistencyException extends RegattaException {

    public DataInconsistencyException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "data_inconsistency", message, List.of());
    }
}
