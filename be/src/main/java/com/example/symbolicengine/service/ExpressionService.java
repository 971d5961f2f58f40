package com.example.symbolicengine.service;

import com.example.symbolicengine.api.v1.dto.EvaluationResponse;
import com.example.symbolicengine.api.v1.dto.ExpressionNodeDto;
import com.example.symbolicengine.api.v1.dto.ExpressionResponse;
import com.example.symbolicengine.api.v1.dto.TokenDto;
import com.example.symbolicengine.api.v1.dto.TokenizeResponse;
import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application service mapping API requests onto the {@link ExpressionEngine} and engine results onto DTOs.
 * <p>
 * Rejects expressions longer than {@code symbolic.engine.max-expression-length} before they reach the engine.
 * </p>
 */
@Service
@Slf4j
public class ExpressionService {

    private final ExpressionEngine engine;
    private final int maxExpressionLength;

    public ExpressionService(
            ExpressionEngine engine,
            @Value("${symbolic.engine.max-expression-length:10000}") int maxExpressionLength) {
        if (maxExpressionLength <= 0) {
            throw new IllegalStateException("symbolic.engine.max-expression-length must be positive, got " + maxExpressionLength);
        }
        this.engine = engine;
        this.maxExpressionLength = maxExpressionLength;
    }

    public TokenizeResponse tokenize(String expression) {
        checkLength(expression);
        List<TokenDto> tokens = engine.tokenize(expression).stream()
                .map(t -> new TokenDto(t.type().name(), t.text(), t.position()))
                .toList();
        log.debug("Tokenized expression length={} tokens={}", expression.length(), tokens.size());
        return new TokenizeResponse(tokens);
    }

    public ExpressionResponse parse(String expression) {
        return toResponse(parseChecked(expression));
    }

    public EvaluationResponse evaluate(String expression, Map<String, ?> bindings) {
        return evaluate(parseChecked(expression), bindings);
    }

    public EvaluationResponse evaluate(Expression expression, Map<String, ?> bindings) {
        Map<String, ?> values = bindings != null ? bindings : Map.of();
        Expression result = engine.evaluate(expression, values);
        if (result instanceof Expression.Literal literal) {
            log.debug("Evaluated to number bindings={}", values.keySet());
            return EvaluationResponse.numeric(literal.value(), literal.render());
        }
        List<String> unbound = List.copyOf(engine.freeSymbols(result));
        log.debug("Evaluated to residual expression unbound={}", unbound);
        return EvaluationResponse.residual(result.render(), unbound);
    }

    public ExpressionResponse simplify(String expression) {
        return toResponse(engine.simplify(parseChecked(expression)));
    }

    /**
     * Substitutes symbols; string replacement values are parsed as expressions, numbers become literals.
     */
    public ExpressionResponse substitute(String expression, Map<String, Object> replacements) {
        Expression parsed = parseChecked(expression);
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (replacements != null) {
            for (Map.Entry<String, Object> entry : replacements.entrySet()) {
                Object value = entry.getValue();
                resolved.put(entry.getKey(), value instanceof String text ? parseChecked(text) : value);
            }
        }
        log.debug("Substituting symbols={}", resolved.keySet());
        return toResponse(engine.substitute(parsed, resolved));
    }

    Expression parseChecked(String expression) {
        checkLength(expression);
        return engine.parse(expression);
    }

    ExpressionResponse toResponse(Expression expression) {
        return new ExpressionResponse(
                expression.render(),
                toNode(expression),
                List.copyOf(engine.freeSymbols(expression))
        );
    }

    private void checkLength(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression is required");
        }
        if (expression.length() > maxExpressionLength) {
            throw new IllegalArgumentException("expression must be at most " + maxExpressionLength + " characters");
        }
    }

    private static ExpressionNodeDto toNode(Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            return ExpressionNodeDto.literal(literal.value());
        }
        if (expression instanceof Expression.Symbol symbol) {
            return ExpressionNodeDto.symbol(symbol.name());
        }
        Expression.Operator operator = (Expression.Operator) expression;
        List<ExpressionNodeDto> operands = new ArrayList<>(operator.operands().size());
        for (Expression operand : operator.operands()) {
            operands.add(toNode(operand));
        }
        return ExpressionNodeDto.operator(operator.kind().name().toLowerCase(Locale.ROOT), operands);
    }
}
