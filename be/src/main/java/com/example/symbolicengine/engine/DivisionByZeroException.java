package com.example.symbolicengine.engine;

/**
 * Thrown when a division has a denominator that evaluates to zero.
 */
public class DivisionByZeroException extends ExpressionException {

    public DivisionByZeroException(Expression.Operator division) {
        super("Division by zero in " + division.render());
    }
}
