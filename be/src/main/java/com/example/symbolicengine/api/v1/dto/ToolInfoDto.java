package com.example.symbolicengine.api.v1.dto;

import java.util.List;

/**
 * API response for one available tool: id, description and the names of its functions.
 */
public record ToolInfoDto(String id, String description, List<String> functions) {}
