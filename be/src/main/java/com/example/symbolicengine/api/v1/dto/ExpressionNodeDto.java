package com.example.symbolicengine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON form of an expression tree node. {@code type} is "literal", "symbol" or "operator";
 * only the fields of that type are present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpressionNodeDto(
        String type,
        Number value,
        String name,
        String operator,
        List<ExpressionNodeDto> operands
) {
    public static ExpressionNodeDto literal(Number value) {
        return new ExpressionNodeDto("literal", value, null, null, null);
    }

    public static ExpressionNodeDto symbol(String name) {
        return new ExpressionNodeDto("symbol", null, name, null, null);
    }

    public static ExpressionNodeDto operator(String operator, List<ExpressionNodeDto> operands) {
        return new ExpressionNodeDto("operator", null, null, operator, operands);
    }
}
