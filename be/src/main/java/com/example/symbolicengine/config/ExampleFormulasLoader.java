package com.example.symbolicengine.config;

import com.example.symbolicengine.api.v1.dto.FormulaCreateRequest;
import com.example.symbolicengine.api.v1.dto.FormulaUpdateRequest;
import com.example.symbolicengine.domain.FormulaDefinition;
import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.engine.ExpressionException;
import com.example.symbolicengine.repository.FormulaDefinitionRepository;
import com.example.symbolicengine.service.FormulaDefinitionService;
import com.example.symbolicengine.validation.FormulaValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Seeds the formula library from {@code examples/*.json} on the classpath at startup.
 * <p>
 * Each example is parsed first and, when it carries a {@code check}, evaluated with the check bindings and
 * compared to the expected value. Examples that fail either step are not stored. An example whose canonical
 * form and description match the stored formula of the same name is left untouched.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExampleFormulasLoader implements ApplicationRunner {

    static final String EXAMPLES_PATTERN = "classpath*:examples/*.json";

    /** Relative tolerance for check values. */
    static final double CHECK_TOLERANCE = 1e-9;

    enum Outcome {
        CREATED, UPDATED, UNCHANGED, REJECTED
    }

    /**
     * One example file. {@code check} is optional.
     */
    record ExampleFormula(String name, String description, String expression, Check check) {
    }

    /**
     * Bindings to evaluate an example with and the number it must produce.
     */
    record Check(Map<String, Object> bindings, Double expected) {
    }

    private final FormulaDefinitionRepository repository;
    private final FormulaDefinitionService service;
    private final ExpressionEngine engine;
    private final JsonMapper jsonMapper;
    private final ResourcePatternResolver resources = new PathMatchingResourcePatternResolver();

    @Override
    public void run(ApplicationArguments args) {
        Resource[] found;
        try {
            found = resources.getResources(EXAMPLES_PATTERN);
        } catch (IOException e) {
            log.error("Failed to list example formulas {}: {}", EXAMPLES_PATTERN, e.getMessage());
            return;
        }
        Arrays.sort(found, Comparator.comparing(resource -> String.valueOf(resource.getFilename())));

        Map<Outcome, Integer> outcomes = new EnumMap<>(Outcome.class);
        for (Resource resource : found) {
            Outcome outcome = read(resource).map(this::seed).orElse(Outcome.REJECTED);
            outcomes.merge(outcome, 1, Integer::sum);
        }
        log.info("Seeded {} example formulas: {}", found.length, outcomes);
    }

    /**
     * Stores one example unless it fails to parse or its check does not hold.
     */
    Outcome seed(ExampleFormula example) {
        if (example.name() == null || example.expression() == null) {
            log.error("Example formula without name or expression: {}", example);
            return Outcome.REJECTED;
        }
        Expression parsed;
        try {
            parsed = engine.parse(example.expression());
        } catch (ExpressionException e) {
            log.error("Example formula '{}' does not parse: {}", example.name(), e.getMessage());
            return Outcome.REJECTED;
        }
        if (example.check() != null && !checkHolds(example, parsed)) {
            return Outcome.REJECTED;
        }

        String canonical = parsed.render();
        Optional<FormulaDefinition> existing = repository.findByName(example.name());
        Outcome outcome;
        try {
            if (existing.isEmpty()) {
                service.create(new FormulaCreateRequest(example.name(), example.expression(), example.description()));
                outcome = Outcome.CREATED;
            } else if (canonical.equals(existing.get().getCanonicalForm())
                    && Objects.equals(example.description(), existing.get().getDescription())) {
                outcome = Outcome.UNCHANGED;
            } else {
                service.update(existing.get().getId(),
                        new FormulaUpdateRequest(example.name(), example.expression(), example.description()));
                outcome = Outcome.UPDATED;
            }
        } catch (FormulaValidationException e) {
            log.error("Example formula '{}' rejected: {}", example.name(), e.getErrors());
            return Outcome.REJECTED;
        }
        log.info("Example formula '{}' {} canonical={}", example.name(), outcome, canonical);
        return outcome;
    }

    private boolean checkHolds(ExampleFormula example, Expression parsed) {
        Check check = example.check();
        Map<String, Object> bindings = check.bindings() != null ? check.bindings() : Map.of();
        Number actual;
        try {
            actual = engine.evaluateToNumber(parsed, bindings);
        } catch (ExpressionException e) {
            log.error("Example formula '{}' check failed: {}", example.name(), e.getMessage());
            return false;
        }
        if (check.expected() == null) {
            return true;
        }
        double expected = check.expected();
        if (Math.abs(actual.doubleValue() - expected) > CHECK_TOLERANCE * Math.max(1, Math.abs(expected))) {
            log.error("Example formula '{}' check failed: bindings={} expected={} actual={}",
                    example.name(), bindings, expected, actual);
            return false;
        }
        log.debug("Example formula '{}' check passed: {}", example.name(), actual);
        return true;
    }

    private Optional<ExampleFormula> read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(jsonMapper.readValue(in, ExampleFormula.class));
        } catch (JacksonException e) {
            log.error("Failed to parse example formula {}: {}", resource.getFilename(), e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read example formula {}: {}", resource.getFilename(), e.getMessage());
        }
        return Optional.empty();
    }
}
