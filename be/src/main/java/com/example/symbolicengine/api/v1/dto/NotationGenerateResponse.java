package com.example.symbolicengine.api.v1.dto;

public record NotationGenerateResponse(String generated) {}
