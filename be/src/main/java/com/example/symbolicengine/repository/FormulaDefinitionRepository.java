package com.example.symbolicengine.repository;

import com.example.symbolicengine.domain.FormulaDefinition;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FormulaDefinitionRepository extends JpaRepository<FormulaDefinition, UUID> {

    Optional<FormulaDefinition> findByName(String name);

    List<FormulaDefinition> findByNameIn(List<String> names);
}
