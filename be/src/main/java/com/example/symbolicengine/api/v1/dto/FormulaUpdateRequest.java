package com.example.symbolicengine.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for updating a formula (full replacement).
 */
public record FormulaUpdateRequest(
        @NotBlank String name,
        @NotBlank String expression,
        String description
) {}
