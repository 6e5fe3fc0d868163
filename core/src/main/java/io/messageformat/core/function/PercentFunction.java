package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.Map;

/**
 * {@code :percent} displays and selects on the operand multiplied by 100. The value itself is
 * stored unscaled.
 */
public final class PercentFunction implements MessageFunction {

    private static final OptionSchema SCHEMA = OptionSchema.builder("percent")
            .options(NumberFunction.FRACTION_DIGITS, "minimumFractionDigits", "maximumFractionDigits")
            .options(NumberFunction.SIGNIFICANT_DIGITS, "minimumSignificantDigits", "maximumSignificantDigits")
            .option("roundingMode", NumberFunction.ROUNDING_MODE)
            .option("signDisplay", NumberFunction.SIGN_DISPLAY)
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
        Map<String, Object> merged = NumberResults.baseOptions(ctx, input, "percent");
        SCHEMA.apply(ctx, exprOptions, merged);
        return NumberResults.toValue(ctx, input.value(), merged, exprOptions, true);
    }
}
