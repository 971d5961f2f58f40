package com.example.symbolicengine.engine;

import com.example.symbolicengine.engine.Expression.Literal;
import com.example.symbolicengine.engine.Expression.Operator;
import com.example.symbolicengine.engine.Expression.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tree transforms: partial evaluation, one-pass simplification and symbol substitution.
 * <p>
 * Every transform is bottom-up and returns a new tree; subtrees that did not change are returned as
 * the same instances. The evaluator has no state and may be shared between threads.
 * </p>
 */
public class Evaluator {

    /**
     * Evaluates {@code expression} with the given symbol values.
     * <p>
     * Bound symbols become literals, operators whose operands are all literals are computed, and the
     * rest is rebuilt around the evaluated operands. The result is a {@link Literal} exactly when no
     * free symbol remains.
     * </p>
     *
     * @param bindings symbol name to value; every value that is used must be a {@link Number}
     * @throws BindingTypeException     if a used binding is not a finite number
     * @throws DivisionByZeroException  if a denominator evaluates to zero
     * @throws NumericDomainException   if a power or an overflow has no finite real result
     */
    public Expression evaluate(Expression expression, Map<String, ?> bindings) {
        Map<String, ?> values = bindings != null ? bindings : Map.of();
        if (expression instanceof Literal) {
            return expression;
        }
        if (expression instanceof Symbol symbol) {
            if (!values.containsKey(symbol.name())) {
                return symbol;
            }
            return toLiteral(symbol.name(), values.get(symbol.name()));
        }
        Operator operator = (Operator) expression;
        List<Expression> evaluated = new ArrayList<>(operator.operands().size());
        boolean numeric = true;
        for (Expression operand : operator.operands()) {
            Expression result = evaluate(operand, values);
            numeric &= result instanceof Literal;
            evaluated.add(result);
        }
        if (!numeric) {
            return operator.withOperands(evaluated);
        }
        List<Number> numbers = new ArrayList<>(evaluated.size());
        for (Expression operand : evaluated) {
            numbers.add(((Literal) operand).value());
        }
        return new Literal(apply(operator, numbers));
    }

    /**
     * Applies the additive, multiplicative and power identities once per node, children first.
     * <p>
     * Subtraction and division are only rebuilt over their simplified operands. The rewritten node is
     * not simplified again.
     * </p>
     */
    public Expression simplify(Expression expression) {
        if (!(expression instanceof Operator operator)) {
            return expression;
        }
        List<Expression> operands = new ArrayList<>(operator.operands().size());
        for (Expression operand : operator.operands()) {
            operands.add(simplify(operand));
        }
        return switch (operator.kind()) {
            case ADD -> simplifySum(operator, operands);
            case MULTIPLY -> simplifyProduct(operator, operands);
            case POWER -> simplifyPower(operator, operands);
            case SUBTRACT, DIVIDE -> operator.withOperands(operands);
        };
    }

    /**
     * Replaces every symbol named in {@code replacements} by its replacement.
     * <p>
     * A replacement is either an {@link Expression} or a {@link Number} (turned into a literal).
     * Operator kinds and operand counts are preserved.
     * </p>
     *
     * @throws BindingTypeException if a used replacement is neither an expression nor a number
     */
    public Expression substitute(Expression expression, Map<String, ?> replacements) {
        if (expression instanceof Symbol symbol) {
            if (replacements == null || !replacements.containsKey(symbol.name())) {
                return symbol;
            }
            Object replacement = replacements.get(symbol.name());
            if (replacement instanceof Expression replacementExpression) {
                return replacementExpression;
            }
            if (replacement instanceof Number) {
                return toLiteral(symbol.name(), replacement);
            }
            String type = replacement != null ? replacement.getClass().getSimpleName() : "null";
            throw new BindingTypeException(symbol.name(),
                    "Replacement for symbol '" + symbol.name() + "' must be an expression or a number, got " + type);
        }
        if (expression instanceof Operator operator) {
            List<Expression> operands = new ArrayList<>(operator.operands().size());
            for (Expression operand : operator.operands()) {
                operands.add(substitute(operand, replacements));
            }
            return operator.withOperands(operands);
        }
        return expression;
    }

    private Number apply(Operator operator, List<Number> values) {
        Number result = switch (operator.kind()) {
            case ADD -> {
                Number sum = 0L;
                for (Number value : values) {
                    sum = Numbers.add(sum, value);
                }
                yield sum;
            }
            case MULTIPLY -> {
                Number product = 1L;
                for (Number value : values) {
                    product = Numbers.multiply(product, value);
                }
                yield product;
            }
            case SUBTRACT -> Numbers.subtract(values.get(0), values.get(1));
            case DIVIDE -> divide(operator, values.get(0), values.get(1));
            case POWER -> power(operator, values.get(0), values.get(1));
        };
        if (!Double.isFinite(result.doubleValue())) {
            throw new NumericDomainException("Result of " + operator.render() + " overflows the real range");
        }
        return result;
    }

    private static Number divide(Operator operator, Number numerator, Number denominator) {
        if (Numbers.isZero(denominator)) {
            throw new DivisionByZeroException(operator);
        }
        return numerator.doubleValue() / denominator.doubleValue();
    }

    private static Number power(Operator operator, Number base, Number exponent) {
        if (base instanceof Long b && exponent instanceof Long e && e >= 0) {
            return Numbers.integerPower(b, e);
        }
        double b = base.doubleValue();
        double e = exponent.doubleValue();
        if (b == 0 && e < 0) {
            throw new NumericDomainException("Zero cannot be raised to a negative power in " + operator.render());
        }
        double result = Math.pow(b, e);
        if (Double.isNaN(result)) {
            throw new NumericDomainException("No real result for " + operator.render());
        }
        return result;
    }

    private static Expression simplifySum(Operator operator, List<Expression> operands) {
        List<Expression> survivors = new ArrayList<>(operands.size());
        for (Expression operand : operands) {
            if (!(operand instanceof Literal literal && literal.isZero())) {
                survivors.add(operand);
            }
        }
        if (survivors.isEmpty()) {
            return Expression.number(0);
        }
        if (survivors.size() == 1) {
            return survivors.get(0);
        }
        return operator.withOperands(survivors);
    }

    private static Expression simplifyProduct(Operator operator, List<Expression> operands) {
        List<Expression> survivors = new ArrayList<>(operands.size());
        for (Expression operand : operands) {
            if (operand instanceof Literal literal) {
                if (literal.isZero()) {
                    return Expression.number(0);
                }
                if (literal.isOne()) {
                    continue;
                }
            }
            survivors.add(operand);
        }
        if (survivors.isEmpty()) {
            return Expression.number(1);
        }
        if (survivors.size() == 1) {
            return survivors.get(0);
        }
        return operator.withOperands(survivors);
    }

    private static Expression simplifyPower(Operator operator, List<Expression> operands) {
        Expression base = operands.get(0);
        Expression exponent = operands.get(1);
        if (exponent instanceof Literal literal && literal.isOne()) {
            return base;
        }
        if (exponent instanceof Literal literal && literal.isZero()) {
            return Expression.number(1);
        }
        if (base instanceof Literal literal && literal.isOne()) {
            return Expression.number(1);
        }
        return operator.withOperands(operands);
    }

    private static Literal toLiteral(String name, Object value) {
        if (!(value instanceof Number number)) {
            throw BindingTypeException.notNumeric(name, value);
        }
        if (!Double.isFinite(number.doubleValue())) {
            throw new BindingTypeException(name, "Value for symbol '" + name + "' must be a finite number, got " + number);
        }
        return new Literal(number);
    }
}
