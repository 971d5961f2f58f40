package com.example.symbolicengine.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for creating a formula.
 */
public record FormulaCreateRequest(
        @NotBlank String name,
        @NotBlank String expression,
        String description
) {}
