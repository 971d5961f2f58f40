package com.example.symbolicengine.engine;

import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Thrown when a numeric result was required but the evaluated tree still has free symbols.
 */
@Getter
public class UnboundSymbolException extends ExpressionException {

    private final SortedSet<String> symbols;

    public UnboundSymbolException(Set<String> symbols, Expression residual) {
        super("Unbound symbols " + new TreeSet<>(symbols) + " in " + residual.render());
        this.symbols = Collections.unmodifiableSortedSet(new TreeSet<>(symbols));
    }
}
