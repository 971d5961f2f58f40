package com.example.symbolicengine.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a formula is not found by id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class FormulaNotFoundException extends RuntimeException {

    private final UUID formulaId;

    public FormulaNotFoundException(UUID formulaId) {
        super("Formula not found: " + formulaId);
        this.formulaId = formulaId;
    }
}
