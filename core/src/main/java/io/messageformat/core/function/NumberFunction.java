package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.Map;

/**
 * {@code :number} formats a numeric operand in decimal style and selects on exact values or
 * plural categories.
 */
public final class NumberFunction implements MessageFunction {

    static final OptionSchema.Rule INTEGER_DIGITS = OptionSchema.integerInRange(1, 21);

    static final OptionSchema.Rule FRACTION_DIGITS = OptionSchema.integerInRange(0, 100);

    static final OptionSchema.Rule SIGNIFICANT_DIGITS = OptionSchema.integerInRange(1, 21);

    static final OptionSchema.Rule ROUNDING_INCREMENT = OptionSchema.integerInRange(1, 5000);

    static final OptionSchema.Rule ROUNDING_MODE = OptionSchema.oneOf(
            "ceil", "floor", "expand", "trunc", "halfCeil", "halfFloor", "halfExpand", "halfTrunc", "halfEven");

    static final OptionSchema.Rule SIGN_DISPLAY = OptionSchema.oneOf("auto", "always", "exceptZero", "negative", "never");

    private static final OptionSchema SCHEMA = OptionSchema.builder("number")
            .option("minimumIntegerDigits", INTEGER_DIGITS)
            .options(FRACTION_DIGITS, "minimumFractionDigits", "maximumFractionDigits")
            .options(SIGNIFICANT_DIGITS, "minimumSignificantDigits", "maximumSignificantDigits")
            .option("roundingIncrement", ROUNDING_INCREMENT)
            .option("roundingMode", ROUNDING_MODE)
            .option("signDisplay", SIGN_DISPLAY)
            .options(OptionSchema.string(), "roundingPriority", "select", "trailingZeroDisplay", "useGrouping")
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
        Map<String, Object> exprOptions = OptionKeys.sanitize(options);
        Map<String, Object> merged = NumberResults.baseOptions(ctx, input, "decimal");
        SCHEMA.apply(ctx, exprOptions, merged);
        return NumberResults.toValue(ctx, input.value(), merged, exprOptions, true);
    }
}
