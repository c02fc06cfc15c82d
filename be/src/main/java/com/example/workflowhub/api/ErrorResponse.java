package com.example.workflowhub.api;

import com.example.workflowhub.validation.ValidationError;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): stable code, message and optional field errors.
 */
public record ErrorResponse(String code, String message, List<ValidationError> errors) {

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }

    public static ErrorResponse withErrors(String code, String message, List<ValidationError> errors) {
        return new ErrorResponse(code, message, errors != null ? List.copyOf(errors) : null);
    }
}
