package com.regatta.web;

import org.springframework.http.HttpStatus;

import java.util.List;

public class NotEligibleException extends RegattaException {

    public NotEligibleException(String message, List<String> details) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "not_eligible", message, details);
    }
}
