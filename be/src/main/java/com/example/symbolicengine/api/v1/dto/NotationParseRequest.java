package com.example.symbolicengine.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

public record NotationParseRequest(@NotBlank String statement) {}
