package com.example.symbolicengine.api.v1;

import com.example.symbolicengine.api.v1.dto.EvaluateRequest;
import com.example.symbolicengine.api.v1.dto.EvaluationResponse;
import com.example.symbolicengine.api.v1.dto.ExpressionRequest;
import com.example.symbolicengine.api.v1.dto.ExpressionResponse;
import com.example.symbolicengine.api.v1.dto.SubstituteRequest;
import com.example.symbolicengine.api.v1.dto.TokenizeResponse;
import com.example.symbolicengine.service.ExpressionService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the expression engine under {@code /api/v1/expressions}.
 * <p>
 * Each operation takes the expression text in the request body: tokenize, parse, evaluate,
 * simplify and substitute. Engine failures are mapped by {@code GlobalExceptionHandler}.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/expressions")
@RequiredArgsConstructor
@Slf4j
public class ExpressionController {

    private final ExpressionService service;

    @PostMapping("/tokenize")
    public ResponseEntity<TokenizeResponse> tokenize(@Valid @RequestBody ExpressionRequest request) {
        log.debug("Tokenizing expression length={}", request.expression().length());
        return ResponseEntity.ok(service.tokenize(request.expression()));
    }

    @PostMapping("/parse")
    public ResponseEntity<ExpressionResponse> parse(@Valid @RequestBody ExpressionRequest request) {
        log.debug("Parsing expression length={}", request.expression().length());
        return ResponseEntity.ok(service.parse(request.expression()));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@Valid @RequestBody EvaluateRequest request) {
        log.info("Evaluating expression bindingKeys={}", request.bindings() != null ? request.bindings().keySet() : "[]");
        return ResponseEntity.ok(service.evaluate(request.expression(), request.bindings()));
    }

    @PostMapping("/simplify")
    public ResponseEntity<ExpressionResponse> simplify(@Valid @RequestBody ExpressionRequest request) {
        log.debug("Simplifying expression length={}", request.expression().length());
        return ResponseEntity.ok(service.simplify(request.expression()));
    }

    @PostMapping("/substitute")
    public ResponseEntity<ExpressionResponse> substitute(@Valid @RequestBody SubstituteRequest request) {
        log.info("Substituting symbols={}", request.replacements().keySet());
        return ResponseEntity.ok(service.substitute(request.expression(), request.replacements()));
    }
}
