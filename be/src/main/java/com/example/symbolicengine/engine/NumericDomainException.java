package com.example.symbolicengine.engine;

/**
 * Thrown when a power has no real result, e.g. a negative base with a fractional exponent.
 */
public class NumericDomainException extends ExpressionException {

    public NumericDomainException(String message) {
        super(message);
    }
}
