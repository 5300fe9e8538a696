package com.regatta.web;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request-shape failures caught before a service runs. Bean validation and
 * unreadable bodies both answer 400 with the offending fields.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    static final String MALFORMED_REQUEST = "malformed_request";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );
        ex.getBindingResult().getGlobalErrors().forEach(ge ->
                fieldErrors.putIfAbsent(ge.getObjectName(), ge.getDefaultMessage())
        );
        return badRequest(RegattaValidationException.VALIDATION_FAILED, "Validation failed", fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ValidationErrorResponse> handle(MethodArgumentTypeMismatchException ex) {
        String detail = "Invalid value for " + ex.getName() + ": " + ex.getValue();
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse(RegattaValidationException.VALIDATION_FAILED, detail,
                        Map.of(ex.getName(), detail)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationErrorResponse> handle(HttpMessageNotReadableException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        if (ex.getCause() instanceof InvalidFormatException) {
            InvalidFormatException invalid = (InvalidFormatException) ex.getCause();
            String field = fieldOf(invalid.getPath());
            if (field != null) {
                fieldErrors.put(field, "Invalid value for " + field + ": " + invalid.getValue());
            }
        }
        return badRequest(MALFORMED_REQUEST, "Malformed request body", fieldErrors);
    }

    private static String fieldOf(List<JsonMappingException.Reference> path) {
        for (int i = path.size() - 1; i >= 0; i--) {
            if (path.get(i).getFieldName() != null) {
                return path.get(i).getFieldName();
            }
        }
        return null;
    }

    private static ResponseEntity<ValidationErrorResponse> badRequest(
            String code,
            String summary,
            Map<String, String> fieldErrors
    ) {
        String detail = fieldErrors.isEmpty()
                ? summary
                : summary + ": " + String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest().body(new ValidationErrorResponse(code, detail, fieldErrors));
    }

    public record ValidationErrorResponse(
            String code,
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
