package com.example.symbolicengine.engine;

import java.util.Objects;

/**
 * One scanned token: its class, the exact source text and the zero-based offset of its first character.
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
    }

    public boolean isOperator(char symbol) {
        return type == TokenType.OPERATOR && text.charAt(0) == symbol;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
