package com.example.symbolicengine.validation;

import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.engine.ExpressionSyntaxException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates a formula definition: required fields, lengths and that the expression parses.
 * <p>
 * The expression is held to {@code symbolic.engine.max-expression-length}, the same limit the evaluation
 * endpoints apply, so every stored formula can be evaluated later.
 * </p>
 */
@Component
public class FormulaValidator {

    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final ExpressionEngine engine;
    private final int maxExpressionLength;

    public FormulaValidator(
            ExpressionEngine engine,
            @Value("${symbolic.engine.max-expression-length:10000}") int maxExpressionLength) {
        this.engine = engine;
        this.maxExpressionLength = maxExpressionLength;
    }

    /**
     * Validates the definition and returns the parsed expression. Throws {@link FormulaValidationException}
     * with all errors if invalid.
     */
    public Expression validate(String name, String expression, String description) {
        List<ValidationError> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add(new ValidationError("name", "name is required"));
        } else if (name.length() > MAX_NAME_LENGTH) {
            errors.add(new ValidationError("name", "name must be at most " + MAX_NAME_LENGTH + " characters"));
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add(new ValidationError("description", "description must be at most " + MAX_DESCRIPTION_LENGTH + " characters"));
        }

        Expression parsed = null;
        if (expression == null || expression.isBlank()) {
            errors.add(new ValidationError("expression", "expression is required"));
        } else if (expression.length() > maxExpressionLength) {
            errors.add(new ValidationError("expression", "expression must be at most " + maxExpressionLength + " characters"));
        } else {
            try {
                parsed = engine.parse(expression);
            } catch (ExpressionSyntaxException e) {
                errors.add(new ValidationError("expression", e.getMessage(), e.getPosition()));
            }
        }

        if (!errors.isEmpty()) {
            throw new FormulaValidationException(errors);
        }
        return parsed;
    }
}
