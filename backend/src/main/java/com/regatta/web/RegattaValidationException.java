package com.regatta.web;

import org.springframework.http.HttpStatus;

import java.util.List;

public class RegattaValidationException extends RegattaException {

    public static final String VALIDATION_FAILED = "validation_failed";

    public RegattaValidationException(String message) {
        this(VALIDATION_FAILED, message);
    }

    public RegattaValidationException(String code, String message) {
        super(HttpStatus.BAD_REQUEST, code, message, List.of());
    }

    public RegattaValidationException(String code, String message, List<String> details) {
        super(HttpStatus.BAD_REQUEST, code, message, details);
    }
}
