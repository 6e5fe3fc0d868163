package io.messageformat.core.number;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Conversions between the supported numeric representations. */
public final class Numbers {

    private Numbers() {
        // utility class
    }

    /**
     * Returns {@code true} for the numeric types the engine accepts as operands: fixed-width
     * integers, floating point and arbitrary precision.
     */
    public static boolean isSupported(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigInteger
                || value instanceof BigDecimal;
    }

    /** Returns {@code true} unless {@code value} is a NaN or infinite floating point number. */
    public static boolean isFinite(Number value) {
        if (value instanceof Double || value instanceof Float) {
            return Double.isFinite(value.doubleValue());
        }
        return true;
    }

    /**
     * Exact decimal view of a finite number. Floating point values use their shortest decimal
     * representation, so {@code 0.01d} becomes {@code 0.01} rather than its binary expansion.
     *
     * @throws ArithmeticException if the value is not finite
     */
    public static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Float) {
            float f = value.floatValue();
            requireFinite(f);
            return new BigDecimal(Float.toString(f));
        }
        if (value instanceof Double) {
            double d = value.doubleValue();
            requireFinite(d);
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(value.longValue());
    }

    /** Returns {@code true} for negative numbers and negative floating point zero. */
    public static boolean isNegative(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            return d < 0 || (d == 0 && 1 / d < 0);
        }
        return toBigDecimal(value).signum() < 0;
    }

    /** Returns {@code true} if the decimal has no fractional part. */
    public static boolean isIntegral(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Canonical string of a decimal: integers without a fraction ({@code 100}), other values in
     * plain notation without trailing zeros ({@code 0.5}).
     */
    public static String canonical(BigDecimal value) {
        if (isIntegral(value)) {
            return value.toBigInteger().toString();
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private static void requireFinite(double d) {
        if (!Double.isFinite(d)) {
            throw new ArithmeticException("Not a finite number: " + d);
        }
    }
}
