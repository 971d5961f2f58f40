package com.example.symbolicengine.api.v1.dto;

import java.util.List;

/**
 * Expression result: canonical rendering, tree and the free symbols.
 */
public record ExpressionResponse(
        String expression,
        ExpressionNodeDto tree,
        List<String> symbols
) {}
