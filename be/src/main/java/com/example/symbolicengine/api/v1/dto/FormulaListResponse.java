package com.example.symbolicengine.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/formulas: list of formula list items.
 */
public record FormulaListResponse(List<FormulaListItem> formulas) {}
