package com.example.symbolicengine.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for a persisted, named formula.
 * <p>
 * Stores the expression as entered and its canonical rendering. Timestamps are set on create and update.
 * </p>
 */
@Entity
@Table(name = "formula_definition")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FormulaDefinition {

    @Id
    private UUID id;

    @Column(nullable = false, unique = true, length = 255)
    private String name;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, columnDefinition = "CLOB")
    private String expression;

    @Column(name = "canonical_form", nullable = false, columnDefinition = "CLOB")
    private String canonicalForm;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public FormulaDefinition(UUID id, String name, String description, String expression, String canonicalForm,
                             Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.expression = Objects.requireNonNull(expression, "expression");
        this.canonicalForm = Objects.requireNonNull(canonicalForm, "canonicalForm");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
