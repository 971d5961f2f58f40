package com.example.symbolicengine.api.v1;

import com.example.symbolicengine.api.v1.dto.NotationGenerateRequest;
import com.example.symbolicengine.api.v1.dto.NotationGenerateResponse;
import com.example.symbolicengine.api.v1.dto.NotationParseRequest;
import com.example.symbolicengine.api.v1.dto.NotationParseResponse;
import com.example.symbolicengine.notation.AssignmentNotation;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Converts between {@code a.b = expression} statements and nested JSON objects.
 */
@RestController
@RequestMapping("/api/v1/notation")
@RequiredArgsConstructor
@Slf4j
public class NotationController {

    private final AssignmentNotation notation;

    @PostMapping("/parse")
    public ResponseEntity<NotationParseResponse> parse(@Valid @RequestBody NotationParseRequest request) {
        log.debug("Parsing notation statement length={}", request.statement().length());
        return ResponseEntity.ok(new NotationParseResponse(notation.parse(request.statement())));
    }

    @PostMapping("/generate")
    public ResponseEntity<NotationGenerateResponse> generate(@Valid @RequestBody NotationGenerateRequest request) {
        log.debug("Generating notation from keys={}", request.data().keySet());
        return ResponseEntity.ok(new NotationGenerateResponse(notation.generate(request.data())));
    }
}
