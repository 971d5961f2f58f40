package com.example.symbolicengine.tools;

import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.engine.ExpressionException;
import com.example.symbolicengine.notation.AssignmentNotation;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;

/**
 * Tool exposing symbolic simplification and substitution.
 */
public class AlgebraTool {

    private final ExpressionEngine engine;
    private final AssignmentNotation notation;

    public AlgebraTool(ExpressionEngine engine, AssignmentNotation notation) {
        this.engine = engine;
        this.notation = notation;
    }

    @Tool("Simplify an expression by removing additive zeros, multiplicative ones and trivial powers")
    public String simplify(@P("Expression to simplify") String expression) {
        if (expression == null || expression.isBlank()) {
            return "Empty expression";
        }
        try {
            return engine.simplify(engine.parse(expression)).render();
        } catch (ExpressionException | IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
    }

    @Tool("Replace variables in an expression by other expressions, e.g. replacements 'x = z + 1; y = 2'")
    public String substitute(@P("Expression") String expression,
                             @P("Replacements as 'name = expression' separated by ';'") String replacements) {
        if (expression == null || expression.isBlank()) {
            return "Empty expression";
        }
        try {
            return engine.substitute(engine.parse(expression), notation.assignments(replacements)).render();
        } catch (ExpressionException | IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
    }
}
