package com.example.symbolicengine.engine;

import lombok.Getter;

/**
 * Failure tied to a character position in the input text: an unknown character or a grammar error.
 */
@Getter
public abstract class ExpressionSyntaxException extends ExpressionException {

    /** Zero-based offset into the expression text. */
    private final int position;

    protected ExpressionSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }
}
