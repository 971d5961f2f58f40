package com.example.symbolicengine.api.v1.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request body for POST /api/v1/expressions/substitute.
 * Replacement values are numbers or expression strings.
 */
public record SubstituteRequest(
        @NotBlank String expression,
        @NotNull Map<String, Object> replacements
) {}
