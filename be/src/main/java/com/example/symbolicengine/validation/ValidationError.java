package com.example.symbolicengine.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single field error. {@code position} is the character offset inside the field's expression text,
 * present only for lexical and parse errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(String field, String message, Integer position) {

    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }

    public ValidationError(String field, String message) {
        this(field, message, null);
    }
}
