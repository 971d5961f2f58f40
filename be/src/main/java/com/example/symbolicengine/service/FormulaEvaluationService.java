package com.example.symbolicengine.service;

import com.example.symbolicengine.api.FormulaNotFoundException;
import com.example.symbolicengine.api.v1.dto.EvaluationResponse;
import com.example.symbolicengine.api.v1.dto.ExpressionResponse;
import com.example.symbolicengine.domain.FormulaDefinition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Evaluates and rewrites a stored formula by id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FormulaEvaluationService {

    private final FormulaDefinitionService formulaDefinitionService;
    private final ExpressionService expressionService;

    /**
     * Evaluates the formula with the given id. Unbound symbols leave a residual expression in the response.
     *
     * @throws FormulaNotFoundException if the formula does not exist
     */
    public EvaluationResponse evaluate(UUID formulaId, Map<String, Object> bindings) {
        FormulaDefinition formula = formulaDefinitionService.load(formulaId);
        Map<String, Object> values = bindings != null ? bindings : Map.of();
        log.info("Evaluate formula id={} name={} bindingKeys={}", formulaId, formula.getName(), values.keySet());
        EvaluationResponse response = expressionService.evaluate(formula.getExpression(), values);
        log.info("Formula evaluation completed id={} numeric={} unbound={}",
                formulaId, response.numeric(), response.unboundSymbols());
        return response;
    }

    /**
     * Evaluates with bindings given as text, as they arrive in query parameters.
     *
     * @throws IllegalArgumentException if a value is not a decimal number
     */
    public EvaluationResponse evaluateWithQuery(UUID formulaId, Map<String, String> bindings) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : bindings.entrySet()) {
            values.put(entry.getKey(), parseNumber(entry.getKey(), entry.getValue()));
        }
        return evaluate(formulaId, values);
    }

    /**
     * Replaces symbols in the stored formula; string values are parsed as expressions. The stored formula is
     * not changed.
     */
    public ExpressionResponse substitute(UUID formulaId, Map<String, Object> replacements) {
        FormulaDefinition formula = formulaDefinitionService.load(formulaId);
        log.info("Substitute in formula id={} symbols={}", formulaId,
                replacements != null ? replacements.keySet() : "[]");
        return expressionService.substitute(formula.getExpression(), replacements);
    }

    private static BigDecimal parseNumber(String symbol, String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("binding '" + symbol + "' must be a number, got '" + text + "'");
        }
    }
}
