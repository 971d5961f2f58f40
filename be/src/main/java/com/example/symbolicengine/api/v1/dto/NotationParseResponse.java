package com.example.symbolicengine.api.v1.dto;

import java.util.Map;

public record NotationParseResponse(Map<String, Object> parsed) {}
