package com.example.symbolicengine.engine;

import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser from a token sequence to an {@link Expression} tree.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 *  expression: term (('+' | '-') term)*
 *  term:       power (('*' | '/') power)*
 *  power:      factor ('^' power)?
 *  factor:     NUMBER | IDENTIFIER | '(' expression ')'
 * </pre>
 * {@code + - * /} fold to the left; {@code ^} is right-associative, so {@code 2^3^2} is
 * {@code 2^(3^2)}. The whole token sequence must be consumed.
 * </p>
 * <p>
 * Instances hold a read cursor and are not reusable; create one per parse.
 * </p>
 */
public class Parser {

    private final List<Token> tokens;
    private final int endPosition;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        if (this.tokens.isEmpty()) {
            this.endPosition = 0;
        } else {
            Token last = this.tokens.get(this.tokens.size() - 1);
            this.endPosition = last.position() + last.text().length();
        }
    }

    public Expression parse() {
        Expression result = expression();
        if (!isAtEnd()) {
            Token trailing = peek();
            throw new ParseException("unexpected trailing token '" + trailing.text() + "'", trailing.position());
        }
        return result;
    }

    private Expression expression() {
        Expression left = term();
        while (!isAtEnd() && (peek().isOperator('+') || peek().isOperator('-'))) {
            Token operator = advance();
            Expression right = term();
            left = operator.isOperator('+') ? Expression.add(left, right) : Expression.subtract(left, right);
        }
        return left;
    }

    private Expression term() {
        Expression left = power();
        while (!isAtEnd() && (peek().isOperator('*') || peek().isOperator('/'))) {
            Token operator = advance();
            Expression right = power();
            left = operator.isOperator('*') ? Expression.multiply(left, right) : Expression.divide(left, right);
        }
        return left;
    }

    private Expression power() {
        Expression base = factor();
        if (!isAtEnd() && peek().isOperator('^')) {
            advance();
            return Expression.power(base, power());
        }
        return base;
    }

    private Expression factor() {
        if (isAtEnd()) {
            throw new ParseException("unexpected end of input", endPosition);
        }
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new Expression.Literal(Numbers.parse(token.text()));
            case IDENTIFIER:
                return new Expression.Symbol(token.text());
            case LEFT_PAREN:
                Expression inner = expression();
                if (isAtEnd() || peek().type() != TokenType.RIGHT_PAREN) {
                    int position = isAtEnd() ? endPosition : peek().position();
                    throw new ParseException("mismatched parentheses: '(' at " + token.position() + " is not closed", position);
                }
                advance();
                return inner;
            default:
                throw new ParseException("invalid token in expression '" + token.text() + "'", token.position());
        }
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        return tokens.get(current++);
    }
}
