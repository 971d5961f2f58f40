package com.example.symbolicengine.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for POST /api/v1/expressions/evaluate. Bindings map symbol names to numbers.
 */
public record EvaluateRequest(
        @NotBlank String expression,
        Map<String, Object> bindings
) {}
