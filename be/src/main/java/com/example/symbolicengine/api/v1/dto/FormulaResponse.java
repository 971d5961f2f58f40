package com.example.symbolicengine.api.v1.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Full formula response (get by id, update).
 */
public record FormulaResponse(
        UUID id,
        String name,
        String description,
        String expression,
        String canonicalForm,
        List<String> symbols,
        Instant createdAt,
        Instant updatedAt
) {}
