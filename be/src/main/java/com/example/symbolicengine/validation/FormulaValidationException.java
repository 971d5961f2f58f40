package com.example.symbolicengine.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a formula definition is invalid (blank name, duplicate name, unparsable expression).
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.symbolicengine.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class FormulaValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public FormulaValidationException(List<ValidationError> errors) {
        super("Formula validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
