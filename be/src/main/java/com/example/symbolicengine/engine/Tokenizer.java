package com.example.symbolicengine.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an infix expression into {@link Token}s, skipping whitespace.
 * <p>
 * Token classes, matched greedily: a number ({@code 12}, {@code 3.25}), an identifier (letter or
 * underscore, then letters, digits or underscores) and the single characters {@code + - * / ^ ( )}.
 * Any other character fails the whole call with a {@link LexicalException}.
 * </p>
 */
public class Tokenizer {

    public List<Token> tokenize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("expression text must not be null");
        }
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isDigit(c)) {
                i = scanNumber(text, i, tokens);
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < text.length() && isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, text.substring(start, i), start));
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i++));
            } else if (OperatorKind.fromSymbol(c).isPresent()) {
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i++));
            } else {
                throw new LexicalException(c, i);
            }
        }
        return List.copyOf(tokens);
    }

    private static int scanNumber(String text, int start, List<Token> tokens) {
        int i = start;
        while (i < text.length() && isDigit(text.charAt(i))) {
            i++;
        }
        if (i < text.length() && text.charAt(i) == '.') {
            // the fraction needs at least one digit; a bare '.' is left for the main loop to reject
            if (i + 1 < text.length() && isDigit(text.charAt(i + 1))) {
                i++;
                while (i < text.length() && isDigit(text.charAt(i))) {
                    i++;
                }
            }
        }
        tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
        return i;
    }

    static boolean isIdentifier(String name) {
        if (name.isEmpty() || !isIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
