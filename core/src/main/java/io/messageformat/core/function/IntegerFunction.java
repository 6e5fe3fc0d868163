package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.number.Numbers;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;

/**
 * {@code :integer} rounds finite operands to the nearest integer, ties away from zero, and never
 * shows fraction digits. NaN and infinities pass through.
 */
public final class IntegerFunction implements MessageFunction {

    private static final OptionSchema SCHEMA = OptionSchema.builder("integer")
            .option("minimumIntegerDigits", NumberFunction.INTEGER_DIGITS)
            .option("maximumSignificantDigits", NumberFunction.SIGNIFICANT_DIGITS)
            .option("signDisplay", NumberFunction.SIGN_DISPLAY)
            .options(OptionSchema.string(), "select", "useGrouping")
            .build();

    @Override
    public MessageValue call(FunctionContext ctx, Map<String, Object> options, Object operand) {
        NumericInput input;
        try {
            input = NumericOperand.read(operand, ctx.source());
        } catch (MessageResolutionException e) {
            ctx.onError(e);
            return NumberResults.fallback(ctx);
        }
        Number value = round(input.value());
        Map<String, Object> exprOptions = OptionKeys.sanitize(options);
        Map<String, Object> merged = NumberResults.baseOptions(ctx, input, "decimal");
        merged.remove("minimumFractionDigits");
        SCHEMA.apply(ctx, exprOptions, merged);
        merged.put("maximumFractionDigits", 0);
        return NumberResults.toValue(ctx, value, merged, exprOptions, true);
    }

    /** Rounds half away from zero. Fixed-width integers are returned as they are. */
    static Number round(Number value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value;
        }
        if (!Numbers.isFinite(value)) {
            return value;
        }
        BigInteger rounded = Numbers.toBigDecimal(value).setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();
        if (value instanceof BigDecimal) {
            return new BigDecimal(rounded);
        }
        return rounded.bitLength() < Long.SIZE ? Long.valueOf(rounded.longValue()) : rounded;
    }
}
