package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.value.MessageValue;
import io.messageformat.core.value.NumberValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Shared implementation of {@code :offset} and {@code :math}: exactly one of {@code add} and
 * {@code subtract} is applied to the operand, and the result is formatted by {@code :number} with
 * the operand's options.
 */
final class NumericDelta {

    private static final NumberFunction NUMBER = new NumberFunction();

    private NumericDelta() {
        // utility class
    }

    static MessageValue apply(String function, FunctionContext ctx, Map<String, Object> options, Object operand) {
        NumericInput input;
        try {
            input = NumericOperand.read(operand, ctx.source());
        } catch (MessageResolutionException e) {
            ctx.onError(e);
            return NumberResults.fallback(ctx);
        }
        Map<String, Object> exprOptions = options != null ? options : Map.of();

        Integer add = null;
        Integer subtract = null;
        try {
            add = amount(function, exprOptions, "add");
            subtract = amount(function, exprOptions, "subtract");
        } catch (IllegalArgumentException e) {
            ctx.onError(MessageResolutionException.badOption(e.getMessage(), ctx.source()));
            return NumberResults.fallback(ctx);
        }
        if ((add == null) == (subtract == null)) {
            ctx.onError(MessageResolutionException.badOption(
                    "Exactly one of \"add\" or \"subtract\" is required as a :" + function + " option",
                    ctx.source()));
            return NumberResults.fallback(ctx);
        }

        int delta = add != null ? add : -subtract;
        Number result = plus(input.value(), delta);
        NumberValue carrier = new NumberValue(
                result, ctx.firstLocale(), ctx.source(), null, input.options(), true);
        return NUMBER.call(ctx, Map.of(), carrier);
    }

    private static Integer amount(String function, Map<String, Object> options, String name) {
        Object value = options.get(name);
        if (value == null) {
            return null;
        }
        try {
            return Coercions.asPositiveInteger(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Value " + Coercions.unwrap(value) + " is not valid for :" + function + " option " + name, e);
        }
    }

    /** Adds {@code delta} keeping the numeric type of {@code value}. */
    static Number plus(Number value, int delta) {
        if (value instanceof Integer) {
            long sum = value.longValue() + delta;
            return sum == (int) sum ? Integer.valueOf((int) sum) : Long.valueOf(sum);
        }
        if (value instanceof Short || value instanceof Byte) {
            return value.intValue() + delta;
        }
        if (value instanceof Long) {
            try {
                return Math.addExact(value.longValue(), delta);
            } catch (ArithmeticException e) {
                return BigInteger.valueOf(value.longValue()).add(BigInteger.valueOf(delta));
            }
        }
        if (value instanceof Double) {
            return value.doubleValue() + delta;
        }
        if (value instanceof Float) {
            return value.floatValue() + delta;
        }
        if (value instanceof BigInteger integer) {
            return integer.add(BigInteger.valueOf(delta));
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.add(BigDecimal.valueOf(delta));
        }
        throw new IllegalArgumentException("Unsupported numeric type: " + value.getClass().getName());
    }
}
