package com.example.symbolicengine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A Platonic solid with its counts and formulas; numeric values only when an edge length was given.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolidResponse(
        String name,
        int vertices,
        int edges,
        int faces,
        String volume,
        String surfaceArea,
        Double edgeLength,
        Number volumeValue,
        Number surfaceAreaValue
) {}
