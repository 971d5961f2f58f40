package com.example.symbolicengine.api.v1.dto;

/**
 * A plane point.
 */
public record PointDto(double x, double y) {}
