package com.example.symbolicengine.engine;

import lombok.Getter;

/**
 * Thrown when the input contains a character that does not start any token.
 */
@Getter
public class LexicalException extends ExpressionSyntaxException {

    private final char character;

    public LexicalException(char character, int position) {
        super("Unexpected character '" + character + "' at position " + position, position);
        this.character = character;
    }
}
