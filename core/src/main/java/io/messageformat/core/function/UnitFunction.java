package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.Map;

/**
 * {@code :unit} formats a measurement such as {@code 5 km}. A unit identifier is required, from
 * the {@code unit} option or from a resolved operand. Unit values are not selectable.
 */
public final class UnitFunction implements MessageFunction {

    private static final OptionSchema SCHEMA = OptionSchema.builder("unit")
            .options(OptionSchema.string(), "unit", "roundingPriority", "trailingZeroDisplay", "useGrouping")
            .option("unitDisplay", OptionSchema.oneOf("short", "narrow", "long"))
            .option("roundingMode", NumberFunction.ROUNDING_MODE)
            .option("signDisplay", NumberFunction.SIGN_DISPLAY)
            .option("minimumIntegerDigits", NumberFunction.INTEGER_DIGITS)
            .options(NumberFunction.FRACTION_DIGITS, "minimumFractionDigits", "maximumFractionDigits")
            .options(NumberFunction.SIGNIFICANT_DIGITS, "minimumSignificantDigits", "maximumSignificantDigits")
            .option("roundingIncrement", NumberFunction.ROUNDING_INCREMENT)
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
        Map<String, Object> merged = NumberResults.baseOptions(ctx, input, "unit");
        SCHEMA.apply(ctx, exprOptions, merged);
        if (!(merged.get("unit") instanceof String)) {
            ctx.onError(MessageResolutionException.badOperand("A unit identifier is required for :unit", ctx.source()));
            return NumberResults.fallback(ctx);
        }
        return NumberResults.toValue(ctx, input.value(), merged, exprOptions, false);
    }
}
