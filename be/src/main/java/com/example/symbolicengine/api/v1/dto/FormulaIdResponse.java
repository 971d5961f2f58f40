package com.example.symbolicengine.api.v1.dto;

import java.util.UUID;

/**
 * Response after creating a formula (201): only the id.
 */
public record FormulaIdResponse(UUID id) {}
