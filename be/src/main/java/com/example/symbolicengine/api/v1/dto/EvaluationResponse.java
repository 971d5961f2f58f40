package com.example.symbolicengine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of an evaluation: {@code value} when fully numeric, otherwise the residual
 * expression and the symbols still unbound.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationResponse(
        boolean numeric,
        Number value,
        String expression,
        List<String> unboundSymbols
) {
    public static EvaluationResponse numeric(Number value, String rendered) {
        return new EvaluationResponse(true, value, rendered, null);
    }

    public static EvaluationResponse residual(String rendered, List<String> unboundSymbols) {
        return new EvaluationResponse(false, null, rendered, unboundSymbols);
    }
}
