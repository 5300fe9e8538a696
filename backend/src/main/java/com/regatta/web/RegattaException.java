package com.regatta.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Base of the errors surfaced to API callers. {@code code} is a stable machine
 * code; {@code details} lists per-item causes where an operation covers many.
 */
@Getter
public abstract class RegattaException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final List<String> details;

    protected RegattaException(HttpStatus status, String code, String message, List<String> details) {
        super(message);
        this.status = status;
        this.code = code;
        this.details = details == null ? List.of() : List.copyOf(details);
    }
}
