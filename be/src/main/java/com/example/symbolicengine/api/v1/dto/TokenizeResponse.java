package com.example.symbolicengine.api.v1.dto;

import java.util.List;

public record TokenizeResponse(List<TokenDto> tokens) {}
