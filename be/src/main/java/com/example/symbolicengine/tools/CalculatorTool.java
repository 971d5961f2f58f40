package com.example.symbolicengine.tools;

import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.engine.ExpressionException;
import com.example.symbolicengine.notation.AssignmentNotation;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;

import java.util.Map;

/**
 * Tool that evaluates arithmetic expressions with the symbolic engine, optionally binding variables.
 * Unbound variables are left in the result.
 */
public class CalculatorTool {

    private final ExpressionEngine engine;
    private final AssignmentNotation notation;

    public CalculatorTool(ExpressionEngine engine, AssignmentNotation notation) {
        this.engine = engine;
        this.notation = notation;
    }

    @Tool("Evaluate an arithmetic expression (e.g. 2 + 3 * 4, 2^10). Supports + - * / ^ ( ) and variables.")
    public String calculate(@P("Arithmetic expression") String expression) {
        return calculateWith(expression, null);
    }

    @Tool("Evaluate an arithmetic expression with variable values, e.g. expression 'x + 2 * y' and bindings 'x = 3; y = 4'")
    public String calculateWith(@P("Arithmetic expression") String expression,
                                @P("Variable values as 'name = value' separated by ';'") String bindings) {
        if (expression == null || expression.isBlank()) {
            return "Empty expression";
        }
        try {
            Map<String, Number> values = notation.bindings(bindings);
            Expression result = engine.evaluate(engine.parse(expression), values);
            return result.render();
        } catch (ExpressionException | IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
    }
}
