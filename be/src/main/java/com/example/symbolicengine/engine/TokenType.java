package com.example.symbolicengine.engine;

/**
 * Lexical classes produced by {@link Tokenizer}.
 */
public enum TokenType {
    NUMBER,
    IDENTIFIER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN
}
