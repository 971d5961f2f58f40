package com.example.symbolicengine.engine;

import java.util.Optional;

/**
 * Tag of an {@link Expression.Operator} node.
 * <p>
 * {@link #ADD} and {@link #MULTIPLY} accept any positive number of operands; the other kinds are
 * strictly binary.
 * </p>
 */
public enum OperatorKind {
    ADD('+', true),
    SUBTRACT('-', false),
    MULTIPLY('*', true),
    DIVIDE('/', false),
    POWER('^', false);

    private final char symbol;
    private final boolean variadic;

    OperatorKind(char symbol, boolean variadic) {
        this.symbol = symbol;
        this.variadic = variadic;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public static Optional<OperatorKind> fromSymbol(char symbol) {
        for (OperatorKind kind : values()) {
            if (kind.symbol == symbol) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
