package com.regatta.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@RestControllerAdvice
public class RegattaExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RegattaExceptionHandler.class);

    @ExceptionHandler(RegattaException.class)
    public ResponseEntity<RegattaErrorResponse> handle(RegattaException ex) {
        if (ex instanceof DataInconsistencyException) {
            log.error("Aborted computation on inconsistent data: {}", ex.getMessage());
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new RegattaErrorResponse(ex.getCode(), ex.getMessage(), ex.getDetails()));
    }

    public record RegattaErrorResponse(
            String code,
            String message,
            List<String> details
    ) {
    }
}
