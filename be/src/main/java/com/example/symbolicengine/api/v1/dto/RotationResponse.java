package com.example.symbolicengine.api.v1.dto;

/**
 * Response for GET /api/v1/geometry/angles/{shape}/rotate.
 */
public record RotationResponse(
        AngleResponse angle,
        PointDto center,
        PointDto point,
        PointDto rotated
) {}
