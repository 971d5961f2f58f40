package com.example.symbolicengine.api;

import com.example.symbolicengine.validation.ValidationError;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body for every 4xx/5xx response: a message and, for request or expression problems, the
 * offending fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationError> errors) {

    public ErrorResponse(String message) {
        this(message, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null);
    }

    public static ErrorResponse withError(String message, ValidationError error) {
        return new ErrorResponse(message, List.of(error));
    }
}
