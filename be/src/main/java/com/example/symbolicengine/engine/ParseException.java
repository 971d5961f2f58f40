package com.example.symbolicengine.engine;

/**
 * Thrown when a token sequence does not match the expression grammar.
 */
public class ParseException extends ExpressionSyntaxException {

    public ParseException(String message, int position) {
        super(message + " at position " + position, position);
    }
}
