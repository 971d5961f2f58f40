package com.example.symbolicengine.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body carrying a single expression (tokenize, parse, simplify).
 */
public record ExpressionRequest(@NotBlank String expression) {}
