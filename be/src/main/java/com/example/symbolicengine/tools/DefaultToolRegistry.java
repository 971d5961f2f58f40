package com.example.symbolicengine.tools;

import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.notation.AssignmentNotation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of {@link ToolRegistry} registering the "calculator" and "algebra" tools.
 */
@Component
public class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, Object> tools;

    public DefaultToolRegistry(ExpressionEngine engine, AssignmentNotation notation) {
        this.tools = Map.of(
                "calculator", new CalculatorTool(engine, notation),
                "algebra", new AlgebraTool(engine, notation)
        );
    }

    @Override
    public Object[] getTools(List<String> toolIds) {
        if (toolIds == null || toolIds.isEmpty()) {
            return new Object[0];
        }
        List<Object> result = new ArrayList<>();
        for (String id : toolIds) {
            Object tool = tools.get(id);
            if (tool != null) {
                result.add(tool);
            }
        }
        return result.toArray();
    }

    @Override
    public List<String> getAvailableToolIds() {
        return tools.keySet().stream().sorted().toList();
    }
}
