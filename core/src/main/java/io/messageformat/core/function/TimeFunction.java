package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@code :time style=full|long|medium|short} formats the time only; short by default. */
public final class TimeFunction implements MessageFunction {

    private static final OptionSchema SCHEMA = OptionSchema.builder("time")
            .option("style", (ctx, name, value, target) -> {
                String style = Coercions.asString(value);
                OptionSchema.oneOf(DateTimeResults.STYLES).apply(ctx, "timeStyle", style, target);
            })
            .option("hour12", OptionSchema.bool())
            .options(OptionSchema.string(), "calendar", "timeZone")
            .strict()
            .build();

    @Override
    public MessageValue call(FunctionContext ctx, Map<String, Object> options, Object operand) {
        DateTimeInput input;
        try {
            input = DateTimeOperand.read(operand, ctx.source());
        } catch (MessageResolutionException e) {
            ctx.onError(e);
            return NumberResults.fallback(ctx);
        }
        Map<String, Object> exprOptions = OptionKeys.sanitize(options);
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("localeMatcher", ctx.localeMatcher());
        merged.put("timeStyle", "short");
        SCHEMA.apply(ctx, exprOptions, merged);
        if (exprOptions.get("locale") != null) {
            merged.put("locale", exprOptions.get("locale"));
        }
        return DateTimeResults.toValue(ctx, input, merged);
    }
}
