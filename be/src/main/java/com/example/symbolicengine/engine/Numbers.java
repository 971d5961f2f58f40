package com.example.symbolicengine.engine;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Integer/real number helpers shared by literals and the evaluator.
 * <p>
 * Integers are {@link Long}, reals are {@link Double}. Integer arithmetic stays exact and is promoted to
 * a real when it overflows 64 bits; a real operand makes the result real.
 * </p>
 */
final class Numbers {

    private Numbers() {
    }

    static Number normalize(Number value) {
        if (value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.longValue();
        }
        if (value instanceof Float) {
            return Double.parseDouble(value.toString());
        }
        if (value instanceof BigInteger big) {
            return fromBigInteger(big);
        }
        if (value instanceof BigDecimal decimal) {
            if (decimal.scale() <= 0) {
                return fromBigInteger(decimal.toBigIntegerExact());
            }
            return decimal.doubleValue();
        }
        return value.doubleValue();
    }

    /**
     * Parses a NUMBER token: integers without a fractional part, reals with one.
     */
    static Number parse(String text) {
        if (text.indexOf('.') >= 0) {
            return Double.parseDouble(text);
        }
        return fromBigInteger(new BigInteger(text));
    }

    static String render(Number value) {
        if (value instanceof Long) {
            return value.toString();
        }
        String plain = BigDecimal.valueOf(value.doubleValue()).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    static Number add(Number left, Number right) {
        if (left instanceof Long a && right instanceof Long b) {
            try {
                return Math.addExact(a, b);
            } catch (ArithmeticException overflow) {
                return a.doubleValue() + b.doubleValue();
            }
        }
        return left.doubleValue() + right.doubleValue();
    }

    static Number subtract(Number left, Number right) {
        if (left instanceof Long a && right instanceof Long b) {
            try {
                return Math.subtractExact(a, b);
            } catch (ArithmeticException overflow) {
                return a.doubleValue() - b.doubleValue();
            }
        }
        return left.doubleValue() - right.doubleValue();
    }

    static Number multiply(Number left, Number right) {
        if (left instanceof Long a && right instanceof Long b) {
            try {
                return Math.multiplyExact(a, b);
            } catch (ArithmeticException overflow) {
                return a.doubleValue() * b.doubleValue();
            }
        }
        return left.doubleValue() * right.doubleValue();
    }

    /**
     * Exact integer power for a non-negative exponent, by repeated squaring. Returns a real when the
     * result does not fit in 64 bits.
     */
    static Number integerPower(long base, long exponent) {
        long result = 1;
        long factor = base;
        long remaining = exponent;
        try {
            while (remaining > 0) {
                if ((remaining & 1) == 1) {
                    result = Math.multiplyExact(result, factor);
                }
                remaining >>= 1;
                if (remaining > 0) {
                    factor = Math.multiplyExact(factor, factor);
                }
            }
            return result;
        } catch (ArithmeticException overflow) {
            return Math.pow(base, exponent);
        }
    }

    static boolean isZero(Number value) {
        return value.doubleValue() == 0;
    }

    private static Number fromBigInteger(BigInteger big) {
        if (big.bitLength() < 64) {
            return big.longValue();
        }
        return big.doubleValue();
    }
}
