package io.messageformat.core.function;

import io.messageformat.core.number.Numbers;
import io.messageformat.core.value.MessageValue;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Coerces option values to the types functions expect. Resolved values are unwrapped through
 * {@link MessageValue#valueOf()} first. Each method throws {@link IllegalArgumentException} when
 * the value cannot be coerced.
 */
public final class Coercions {

    private static final Pattern POSITIVE_INTEGER = Pattern.compile("^(0|[1-9][0-9]*)$");

    private Coercions() {
        // utility class
    }

    /** Accepts strings only. */
    public static String asString(Object value) {
        Object raw = unwrap(value);
        if (raw instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("Not a string: " + raw);
    }

    /** Accepts booleans and the strings {@code "true"} and {@code "false"}. */
    public static boolean asBoolean(Object value) {
        Object raw = unwrap(value);
        if (raw instanceof Boolean b) {
            return b;
        }
        if ("true".equals(raw)) {
            return true;
        }
        if ("false".equals(raw)) {
            return false;
        }
        throw new IllegalArgumentException("Not a boolean: " + raw);
    }

    /**
     * Accepts non-negative integral numbers and strings of decimal digits without leading zeros.
     */
    public static int asPositiveInteger(Object value) {
        Object raw = unwrap(value);
        if (raw instanceof String s) {
            if (POSITIVE_INTEGER.matcher(s).matches()) {
                try {
                    return Integer.parseInt(s);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Integer out of range: " + s, e);
                }
            }
        } else if (raw instanceof Number number && Numbers.isSupported(number) && Numbers.isFinite(number)) {
            BigDecimal d = Numbers.toBigDecimal(number);
            if (d.signum() >= 0 && Numbers.isIntegral(d)) {
                try {
                    return d.intValueExact();
                } catch (ArithmeticException e) {
                    throw new IllegalArgumentException("Integer out of range: " + raw, e);
                }
            }
        }
        throw new IllegalArgumentException("Not a positive integer: " + raw);
    }

    static Object unwrap(Object value) {
        return value instanceof MessageValue resolved ? resolved.valueOf() : value;
    }
}
