package com.example.symbolicengine.tools;

import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.notation.AssignmentNotation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AlgebraTool")
class AlgebraToolTest {

    private final ExpressionEngine engine = new ExpressionEngine();
    private final AlgebraTool tool = new AlgebraTool(engine, new AssignmentNotation(engine, 10_000));

    @Test
    @DisplayName("simplifies identities")
    void simplifies() {
        assertEquals("y", tool.simplify("0 * x + y ^ 1"));
        assertEquals("x * y", tool.simplify("x * 1 * y"));
    }

    @Test
    @DisplayName("substitutes sub-expressions")
    void substitutes() {
        assertEquals("(z + 1) + 2", tool.substitute("x + y", "x = z + 1; y = 2"));
        assertEquals("x + y", tool.substitute("x + y", ""));
    }

    @Test
    @DisplayName("returns error text instead of throwing")
    void returnsErrors() {
        assertEquals("Empty expression", tool.simplify(""));
        assertTrue(tool.simplify("(x").startsWith("Error: mismatched parentheses"));
        assertTrue(tool.substitute("x", "x.y = 1").startsWith("Error: Assignment target must be a plain name"));
    }
}
