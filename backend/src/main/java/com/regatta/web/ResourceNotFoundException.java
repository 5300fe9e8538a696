package com.regatta.web;

import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.UUID;

public class ResourceNotFoundException extends RegattaException {

    public ResourceNotFoundException(String message) {
        this(message, List.of());
    }

    public ResourceNotFoundException(String message, List<String> details) {
        super(HttpStatus.NOT_FOUND, "not_found", message, details);
    }

    public static ResourceNotFoundException of(String resource, UUID id) {
        return new ResourceNotFoundException(resource + " not found: " + id);
    }
}
