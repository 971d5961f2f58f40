package com.example.symbolicengine.api.v1.dto;

/**
 * A named angle in degrees and radians.
 */
public record AngleResponse(
        String shape,
        double degrees,
        double radians
) {}
