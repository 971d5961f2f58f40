package com.example.symbolicengine.engine;

import lombok.Getter;

/**
 * Thrown when a symbol is bound (or substituted) with a value of an unsupported type.
 */
@Getter
public class BindingTypeException extends ExpressionException {

    private final String symbol;

    public BindingTypeException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public static BindingTypeException notNumeric(String symbol, Object value) {
        String type = value != null ? value.getClass().getSimpleName() : "null";
        return new BindingTypeException(symbol, "Value for symbol '" + symbol + "' must be numeric, got " + type);
    }
}
