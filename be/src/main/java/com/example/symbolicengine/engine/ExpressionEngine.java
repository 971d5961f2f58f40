package com.example.symbolicengine.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Entry point of the symbolic engine: tokenize, parse, evaluate, simplify, substitute and render.
 * <p>
 * Stateless and thread-safe; a single instance is shared by the REST layer, the formula library,
 * the geometry helpers and the agent tools.
 * </p>
 */
@Slf4j
public class ExpressionEngine {

    private final Tokenizer tokenizer;
    private final Evaluator evaluator;

    public ExpressionEngine() {
        this(new Tokenizer(), new Evaluator());
    }

    public ExpressionEngine(Tokenizer tokenizer, Evaluator evaluator) {
        this.tokenizer = tokenizer;
        this.evaluator = evaluator;
    }

    public List<Token> tokenize(String text) {
        List<Token> tokens = tokenizer.tokenize(text);
        log.trace("Tokenized length={} tokens={}", text.length(), tokens.size());
        return tokens;
    }

    public Expression parse(String text) {
        Expression expression = new Parser(tokenize(text)).parse();
        log.debug("Parsed '{}' as {}", text, expression);
        return expression;
    }

    public Expression evaluate(Expression expression, Map<String, ?> bindings) {
        Expression result = evaluator.evaluate(expression, bindings);
        log.trace("Evaluated {} with bindings={} -> {}", expression, bindings != null ? bindings.keySet() : Collections.emptySet(), result);
        return result;
    }

    /**
     * Evaluates and requires a numeric result.
     *
     * @throws UnboundSymbolException if free symbols remain after binding
     */
    public Number evaluateToNumber(Expression expression, Map<String, ?> bindings) {
        Expression result = evaluate(expression, bindings);
        if (result instanceof Expression.Literal literal) {
            return literal.value();
        }
        throw new UnboundSymbolException(freeSymbols(result), result);
    }

    public Expression simplify(Expression expression) {
        Expression simplified = evaluator.simplify(expression);
        log.trace("Simplified {} -> {}", expression, simplified);
        return simplified;
    }

    public Expression substitute(Expression expression, Map<String, ?> replacements) {
        return evaluator.substitute(expression, replacements);
    }

    public String render(Expression expression) {
        return expression.render();
    }

    /**
     * Names of all symbols occurring in the tree, sorted.
     */
    public SortedSet<String> freeSymbols(Expression expression) {
        SortedSet<String> names = new TreeSet<>();
        collectSymbols(expression, names);
        return Collections.unmodifiableSortedSet(names);
    }

    private static void collectSymbols(Expression expression, SortedSet<String> names) {
        if (expression instanceof Expression.Symbol symbol) {
            names.add(symbol.name());
        } else if (expression instanceof Expression.Operator operator) {
            for (Expression operand : operator.operands()) {
                collectSymbols(operand, names);
            }
        }
    }
}
