package com.example.symbolicengine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response for GET /api/v1/geometry/fibonacci. {@code symbolic} is omitted above the symbolic cap.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FibonacciResponse(
        int count,
        List<Long> sequence,
        List<String> symbolic,
        List<Double> ratios
) {}
