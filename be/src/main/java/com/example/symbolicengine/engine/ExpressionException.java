package com.example.symbolicengine.engine;

/**
 * Base type for every failure raised by the expression engine.
 * <p>
 * Errors are terminal for the call that raised them; the engine keeps no partial state.
 * </p>
 */
public abstract class ExpressionException extends RuntimeException {

    protected ExpressionException(String message) {
        super(message);
    }

    protected ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
