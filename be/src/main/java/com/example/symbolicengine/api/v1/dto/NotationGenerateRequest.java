package com.example.symbolicengine.api.v1.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

public record NotationGenerateRequest(@NotEmpty Map<String, Object> data) {}
