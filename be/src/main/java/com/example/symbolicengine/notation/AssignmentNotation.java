package com.example.symbolicengine.notation;

import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dotted-key assignment statements such as {@code consciousness.level = 4 / 5}.
 * <p>
 * {@link #parse(String)} evaluates the right-hand side and nests the value under the key path;
 * {@link #generate(Map)} flattens a nested map back into {@code key = value} statements joined by
 * {@code "; "}.
 * </p>
 * <p>
 * The expression syntax has no unary minus, so negative numbers are written back as {@code (0) - (n)}
 * and generated statements always parse again.
 * </p>
 */
@Component
@Slf4j
public class AssignmentNotation {

    static final String STATEMENT_SEPARATOR = ";";

    private final ExpressionEngine engine;
    private final int maxStatementLength;

    public AssignmentNotation(
            ExpressionEngine engine,
            @Value("${symbolic.engine.max-expression-length:10000}") int maxStatementLength) {
        this.engine = engine;
        this.maxStatementLength = maxStatementLength;
    }

    /**
     * Parses one statement into a nested map. The leaf value is a {@link Number} when the right-hand
     * side has no free symbols, otherwise the rendering of what is left with negative numbers spelled
     * {@code (0) - (n)}.
     *
     * @throws IllegalArgumentException if the statement is not {@code key(.key)* = expression} or is too long
     */
    public Map<String, Object> parse(String statement) {
        checkLength(statement);
        Assignment assignment = split(statement);
        Expression value = engine.evaluate(engine.parse(assignment.expression()), Map.of());
        Object leaf = value instanceof Expression.Literal literal ? literal.value() : parsableForm(value).render();

        Map<String, Object> result = new LinkedHashMap<>();
        Map<String, Object> current = result;
        List<String> path = assignment.keyPath();
        for (String key : path.subList(0, path.size() - 1)) {
            Map<String, Object> child = new LinkedHashMap<>();
            current.put(key, child);
            current = child;
        }
        current.put(path.get(path.size() - 1), leaf);
        log.debug("Parsed assignment keyPath={} numeric={}", path, leaf instanceof Number);
        return result;
    }

    /**
     * Flattens nested maps into dotted keys and renders {@code key = value} pairs in map order.
     */
    public String generate(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("data must not be empty");
        }
        Map<String, Object> flat = new LinkedHashMap<>();
        flatten("", data, flat);
        StringBuilder generated = new StringBuilder();
        for (Map.Entry<String, Object> entry : flat.entrySet()) {
            if (generated.length() > 0) {
                generated.append(STATEMENT_SEPARATOR).append(' ');
            }
            generated.append(entry.getKey()).append(" = ").append(renderValue(entry.getValue()));
        }
        return generated.toString();
    }

    /**
     * Parses and regenerates a statement, normalising its value.
     */
    public String translate(String statement) {
        return generate(parse(statement));
    }

    /**
     * Parses {@code name = expression} statements separated by {@code ;} without evaluating them.
     * Keys must be plain symbol names.
     */
    public Map<String, Expression> assignments(String statements) {
        Map<String, Expression> result = new LinkedHashMap<>();
        if (statements == null || statements.isBlank()) {
            return result;
        }
        checkLength(statements);
        for (String statement : statements.split(STATEMENT_SEPARATOR)) {
            if (statement.isBlank()) {
                continue;
            }
            Assignment assignment = split(statement);
            if (assignment.keyPath().size() != 1) {
                throw new IllegalArgumentException("Assignment target must be a plain name: " + statement.trim());
            }
            result.put(assignment.keyPath().get(0), engine.parse(assignment.expression()));
        }
        return result;
    }

    /**
     * Like {@link #assignments(String)} but evaluates each right-hand side to a number.
     */
    public Map<String, Number> bindings(String statements) {
        Map<String, Number> result = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : assignments(statements).entrySet()) {
            result.put(entry.getKey(), engine.evaluateToNumber(entry.getValue(), Map.of()));
        }
        return result;
    }

    private static Assignment split(String statement) {
        if (statement == null || statement.isBlank()) {
            throw new IllegalArgumentException("statement must not be blank");
        }
        String[] parts = statement.split("=", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid statement format, expected 'key = expression': " + statement.trim());
        }
        String[] keys = parts[0].trim().split("\\.", -1);
        for (String key : keys) {
            if (key.isBlank()) {
                throw new IllegalArgumentException("Invalid key path: '" + parts[0].trim() + "'");
            }
        }
        List<String> keyPath = Arrays.stream(keys).map(String::trim).toList();
        return new Assignment(keyPath, parts[1].trim());
    }

    private void checkLength(String text) {
        if (text != null && text.length() > maxStatementLength) {
            throw new IllegalArgumentException("statement must be at most " + maxStatementLength + " characters");
        }
    }

    private static void flatten(String prefix, Map<?, ?> data, Map<String, Object> flat) {
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String name = String.valueOf(entry.getKey());
            String key = prefix.isEmpty() ? name : prefix + "." + name;
            if (entry.getValue() instanceof Map<?, ?> nested) {
                flatten(key, nested, flat);
            } else {
                flat.put(key, entry.getValue());
            }
        }
    }

    private static String renderValue(Object value) {
        if (value instanceof Number number && Double.isFinite(number.doubleValue())) {
            return parsableForm(new Expression.Literal(number)).render();
        }
        if (value instanceof Expression expression) {
            return parsableForm(expression).render();
        }
        return String.valueOf(value);
    }

    /**
     * Rewrites every negative literal {@code -n} as {@code 0 - n}.
     */
    static Expression parsableForm(Expression expression) {
        if (expression instanceof Expression.Literal literal && literal.value().doubleValue() < 0) {
            return Expression.subtract(Expression.number(0), negate(literal.value()));
        }
        if (expression instanceof Expression.Operator operator) {
            return operator.withOperands(operator.operands().stream()
                    .map(AssignmentNotation::parsableForm)
                    .toList());
        }
        return expression;
    }

    private static Expression.Literal negate(Number value) {
        if (value instanceof Long integer && integer != Long.MIN_VALUE) {
            return Expression.number(-integer);
        }
        return Expression.number(-value.doubleValue());
    }

    private record Assignment(List<String> keyPath, String expression) {
    }
}
