package com.example.symbolicengine.api.v1.dto;

/**
 * A line segment of a pattern.
 */
public record SegmentDto(PointDto start, PointDto end) {}
