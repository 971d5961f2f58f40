package com.example.symbolicengine.api.v1.dto;

/**
 * Response for GET /api/v1/geometry/golden-ratio: the ratio {@code (a + b) / a} built from the inputs and
 * its evaluation.
 */
public record GoldenRatioResponse(
        String ratio,
        EvaluationResponse result
) {}
