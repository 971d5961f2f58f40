package com.example.symbolicengine.api.v1;

import com.example.symbolicengine.api.v1.dto.ToolInfoDto;
import com.example.symbolicengine.tools.ToolRegistry;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.agent.tool.ToolSpecifications;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller listing the engine-backed tools and their callable functions.
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    private static final Map<String, String> DESCRIPTIONS = Map.of(
            "calculator", "Evaluate arithmetic expressions, optionally with bindings (e.g. 2 + 3 * x; x = 4)",
            "algebra", "Simplify expressions and substitute symbols with sub-expressions"
    );

    private final ToolRegistry toolRegistry;

    @GetMapping
    public List<ToolInfoDto> list() {
        List<String> ids = toolRegistry.getAvailableToolIds();
        log.debug("Listing available tools count={}", ids.size());
        return ids.stream()
                .map(id -> new ToolInfoDto(id, DESCRIPTIONS.getOrDefault(id, ""), functionNames(id)))
                .collect(Collectors.toList());
    }

    private List<String> functionNames(String toolId) {
        Object[] tools = toolRegistry.getTools(List.of(toolId));
        if (tools.length == 0) {
            return List.of();
        }
        return ToolSpecifications.toolSpecificationsFrom(tools[0]).stream()
                .map(ToolSpecification::name)
                .sorted()
                .collect(Collectors.toList());
    }
}
