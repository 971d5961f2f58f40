package com.example.symbolicengine.service;

import com.example.symbolicengine.api.FormulaNotFoundException;
import com.example.symbolicengine.api.v1.dto.FormulaCreateRequest;
import com.example.symbolicengine.api.v1.dto.FormulaListItem;
import com.example.symbolicengine.api.v1.dto.FormulaResponse;
import com.example.symbolicengine.api.v1.dto.FormulaUpdateRequest;
import com.example.symbolicengine.domain.FormulaDefinition;
import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.repository.FormulaDefinitionRepository;
import com.example.symbolicengine.validation.FormulaValidationException;
import com.example.symbolicengine.validation.FormulaValidator;
import com.example.symbolicengine.validation.ValidationError;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static java.util.Collections.unmodifiableList;

/**
 * Application service for formula CRUD.
 * <p>
 * Validates each definition via {@link FormulaValidator} before create/update, stores the entered
 * expression with its canonical rendering, and maps entities to/from DTOs. Names are unique; the
 * database constraint decides, so concurrent writers of the same name get the same field error.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FormulaDefinitionService {

    /** Names of example formulas loaded from classpath at startup. */
    public static final List<String> EXAMPLE_FORMULA_NAMES = unmodifiableList(List.of(
            "Golden ratio",
            "Cube volume",
            "Tetrahedron volume",
            "Dodecahedron volume"
    ));

    private final FormulaDefinitionRepository repository;
    private final FormulaValidator validator;
    private final ExpressionEngine engine;

    @Transactional
    public UUID create(FormulaCreateRequest request) {
        log.debug("Validating and persisting new formula name={}", request.name());
        Expression parsed = validator.validate(request.name(), request.expression(), request.description());
        Instant now = Instant.now();
        UUID id = UUID.randomUUID();
        FormulaDefinition entity = new FormulaDefinition(
                id,
                request.name(),
                request.description(),
                request.expression(),
                parsed.render(),
                now,
                now
        );
        saveUniqueName(entity);
        log.debug("Persisted formula id={} canonical={}", id, entity.getCanonicalForm());
        return id;
    }

    /**
     * Lists all formulas, or only those whose expression uses {@code symbol} when it is given.
     */
    @Transactional(readOnly = true)
    public List<FormulaListItem> findAll(String symbol) {
        boolean filtered = symbol != null && !symbol.isBlank();
        List<FormulaListItem> list = repository.findAll().stream()
                .filter(entity -> !filtered || usesSymbol(entity, symbol.trim()))
                .map(this::toListItem)
                .toList();
        log.debug("findAll symbol={} returned {} formulas", symbol, list.size());
        return list;
    }

    @Transactional(readOnly = true)
    public List<FormulaListItem> findSamples() {
        List<FormulaListItem> list = repository.findByNameIn(EXAMPLE_FORMULA_NAMES).stream()
                .map(this::toListItem)
                .toList();
        log.debug("findSamples returned {} formulas", list.size());
        return list;
    }

    @Transactional(readOnly = true)
    public FormulaResponse findById(UUID id) {
        log.debug("Finding formula by id={}", id);
        return toResponse(load(id));
    }

    @Transactional(readOnly = true)
    public FormulaDefinition load(UUID id) {
        return repository.findById(id)
                .orElseThrow(() -> new FormulaNotFoundException(id));
    }

    @Transactional
    public FormulaResponse update(UUID id, FormulaUpdateRequest request) {
        log.debug("Updating formula id={} name={}", id, request.name());
        FormulaDefinition existing = load(id);
        Expression parsed = validator.validate(request.name(), request.expression(), request.description());
        FormulaDefinition updated = new FormulaDefinition(
                existing.getId(),
                request.name(),
                request.description(),
                request.expression(),
                parsed.render(),
                existing.getCreatedAt(),
                Instant.now()
        );
        saveUniqueName(updated);
        log.debug("Updated formula id={}", id);
        return toResponse(updated);
    }

    @Transactional
    public void delete(UUID id) {
        log.debug("Deleting formula id={}", id);
        if (!repository.existsById(id)) {
            throw new FormulaNotFoundException(id);
        }
        repository.deleteById(id);
    }

    private void saveUniqueName(FormulaDefinition entity) {
        try {
            repository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            log.debug("Rejected formula name={}: {}", entity.getName(), e.getMostSpecificCause().getMessage());
            throw duplicateName(entity.getName());
        }
    }

    private boolean usesSymbol(FormulaDefinition entity, String symbol) {
        return engine.freeSymbols(engine.parse(entity.getExpression())).contains(symbol);
    }

    private FormulaListItem toListItem(FormulaDefinition entity) {
        return new FormulaListItem(entity.getId(), entity.getName(), entity.getUpdatedAt());
    }

    private FormulaResponse toResponse(FormulaDefinition entity) {
        Expression parsed = engine.parse(entity.getExpression());
        return new FormulaResponse(
                entity.getId(),
                entity.getName(),
                entity.getDescription(),
                entity.getExpression(),
                entity.getCanonicalForm(),
                List.copyOf(engine.freeSymbols(parsed)),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private static FormulaValidationException duplicateName(String name) {
        return new FormulaValidationException(List.of(
                new ValidationError("name", "a formula named '" + name + "' already exists")));
    }
}
