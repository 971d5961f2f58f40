package com.example.symbolicengine.api.v1.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * Formula list item (id, name, updatedAt).
 */
public record FormulaListItem(
        UUID id,
        String name,
        Instant updatedAt
) {}
