package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.Map;

/**
 * {@code :currency} formats a monetary amount. A currency code is required, from the {@code
 * currency} option or from a resolved operand. Currency values are not selectable.
 */
public final class CurrencyFunction implements MessageFunction {

    private static final OptionSchema SCHEMA = OptionSchema.builder("currency")
            .options(OptionSchema.string(), "currency", "roundingPriority", "trailingZeroDisplay", "useGrouping")
            .option("currencySign", OptionSchema.oneOf("standard", "accounting"))
            .option("roundingMode", NumberFunction.ROUNDING_MODE)
            .option("signDisplay", NumberFunction.SIGN_DISPLAY)
            .option("minimumIntegerDigits", NumberFunction.INTEGER_DIGITS)
            .options(NumberFunction.SIGNIFICANT_DIGITS, "minimumSignificantDigits", "maximumSignificantDigits")
            .option("roundingIncrement", NumberFunction.ROUNDING_INCREMENT)
            .option("currencyDisplay", CurrencyFunction::currencyDisplay)
            .option("fractionDigits", CurrencyFunction::fractionDigits)
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
        Map<String, Object> merged = NumberResults.baseOptions(ctx, input, "currency");
        SCHEMA.apply(ctx, exprOptions, merged);
        if (!(merged.get("currency") instanceof String)) {
            ctx.onError(MessageResolutionException.badOperand("A currency code is required for :currency", ctx.source()));
            return NumberResults.fallback(ctx);
        }
        return NumberResults.toValue(ctx, input.value(), merged, exprOptions, false);
    }

    private static void currencyDisplay(FunctionContext ctx, String name, Object value, Map<String, Object> target) {
        String display = Coercions.asString(value);
        switch (display) {
            case "never" -> ctx.onError(MessageResolutionException.unsupportedOperation(
                    "Currency display \"never\" is not yet supported", ctx.source()));
            case "symbol", "narrowSymbol", "code", "name" -> target.put(name, display);
            default -> throw new IllegalArgumentException("Unsupported currency display: " + display);
        }
    }

    /** {@code auto} restores the currency's minor units; a number fixes both fraction digit bounds. */
    private static void fractionDigits(FunctionContext ctx, String name, Object value, Map<String, Object> target) {
        String digits = Coercions.asString(value);
        if ("auto".equals(digits)) {
            target.remove("minimumFractionDigits");
            target.remove("maximumFractionDigits");
            return;
        }
        NumberFunction.FRACTION_DIGITS.apply(ctx, "minimumFractionDigits", digits, target);
        target.put("maximumFractionDigits", target.get("minimumFractionDigits"));
    }
}
