package com.example.symbolicengine.api.v1;

import com.example.symbolicengine.api.v1.dto.EvaluationResponse;
import com.example.symbolicengine.api.v1.dto.ExpressionResponse;
import com.example.symbolicengine.api.v1.dto.FormulaCreateRequest;
import com.example.symbolicengine.api.v1.dto.FormulaIdResponse;
import com.example.symbolicengine.api.v1.dto.FormulaListResponse;
import com.example.symbolicengine.api.v1.dto.FormulaResponse;
import com.example.symbolicengine.api.v1.dto.FormulaUpdateRequest;
import com.example.symbolicengine.service.FormulaDefinitionService;
import com.example.symbolicengine.service.FormulaEvaluationService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.UUID;

/**
 * The formula library under {@code /api/v1/formulas}.
 * <p>
 * Besides create, read, update and delete, a stored formula can be evaluated with bindings from a JSON
 * body ({@code POST /{id}/evaluate}) or from query parameters ({@code GET /{id}/evaluate?a=2}), and
 * rewritten with symbol replacements ({@code POST /{id}/substitute}). The list can be narrowed to
 * formulas that use a given symbol.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/formulas")
@RequiredArgsConstructor
@Slf4j
public class FormulaController {

    private final FormulaDefinitionService service;
    private final FormulaEvaluationService evaluationService;

    @PostMapping
    public ResponseEntity<FormulaIdResponse> create(@Valid @RequestBody FormulaCreateRequest request) {
        UUID id = service.create(request);
        log.info("Created formula id={} name={}", id, request.name());
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(id)
                .toUri();
        return ResponseEntity.created(location).body(new FormulaIdResponse(id));
    }

    @GetMapping
    public ResponseEntity<FormulaListResponse> list(@RequestParam(required = false) String symbol) {
        return ResponseEntity.ok(new FormulaListResponse(service.findAll(symbol)));
    }

    @GetMapping("/samples")
    public ResponseEntity<FormulaListResponse> samples() {
        return ResponseEntity.ok(new FormulaListResponse(service.findSamples()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<FormulaResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<FormulaResponse> update(@PathVariable UUID id, @Valid @RequestBody FormulaUpdateRequest request) {
        FormulaResponse updated = service.update(id, request);
        log.info("Updated formula id={} canonical={}", id, updated.canonicalForm());
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        service.delete(id);
        log.info("Deleted formula id={}", id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@PathVariable UUID id, @RequestBody(required = false) Map<String, Object> bindings) {
        return ResponseEntity.ok(evaluationService.evaluate(id, bindings));
    }

    /**
     * Evaluates with every query parameter taken as a numeric binding, e.g. {@code ?a=2&b=0.5}.
     */
    @GetMapping("/{id}/evaluate")
    public ResponseEntity<EvaluationResponse> evaluateWithQuery(@PathVariable UUID id, @RequestParam Map<String, String> bindings) {
        return ResponseEntity.ok(evaluationService.evaluateWithQuery(id, bindings));
    }

    @PostMapping("/{id}/substitute")
    public ResponseEntity<ExpressionResponse> substitute(@PathVariable UUID id, @RequestBody Map<String, Object> replacements) {
        return ResponseEntity.ok(evaluationService.substitute(id, replacements));
    }
}
