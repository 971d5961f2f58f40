package com.example.symbolicengine.api.v1.dto;

/**
 * One token in a tokenize response.
 */
public record TokenDto(String type, String text, int position) {}
