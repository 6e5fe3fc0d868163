package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@code :datetime} formats a date and time.
 *
 * <p>Either the field options ({@code dateFields}, {@code dateLength}, {@code timePrecision},
 * {@code timeZoneStyle}, {@code fractionalSecondDigits}) or the style options ({@code dateStyle},
 * {@code timeStyle}) may be given, not both. With neither, the date is formatted in medium style
 * and the time in short style.
 */
public final class DateTimeFunction implements MessageFunction {

    private static final Set<String> STYLE_OPTIONS = Set.of("dateStyle", "timeStyle");

    private static final Set<String> FIELD_OPTIONS =
            Set.of("dateFields", "dateLength", "timePrecision", "timeZoneStyle", "fractionalSecondDigits");

    private static final OptionSchema SCHEMA = OptionSchema.builder("datetime")
            .options(OptionSchema.oneOf(DateTimeResults.STYLES), "dateStyle", "timeStyle")
            .option("dateFields", OptionSchema.string())
            .option("dateLength", OptionSchema.oneOf("long", "medium", "short"))
            .option("timePrecision", OptionSchema.oneOf("hour", "minute", "second"))
            .option("timeZoneStyle", OptionSchema.oneOf("long", "short"))
            .option("fractionalSecondDigits", OptionSchema.integerInRange(1, 3))
            .option("hour12", OptionSchema.bool())
            .options(OptionSchema.string(), "calendar", "timeZone")
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
        Map<String, Object> given = new LinkedHashMap<>();
        SCHEMA.apply(ctx, exprOptions, given);

        boolean hasStyle = given.keySet().stream().anyMatch(STYLE_OPTIONS::contains);
        boolean hasFields = given.keySet().stream().anyMatch(FIELD_OPTIONS::contains);
        if (hasStyle && hasFields) {
            ctx.onError(MessageResolutionException.badOption(
                    "Style and field options cannot be both set for :datetime", ctx.source()));
            return NumberResults.fallback(ctx);
        }

        Map<String, Object> merged = new LinkedHashMap<>(input.options());
        merged.put("localeMatcher", ctx.localeMatcher());
        if (hasStyle) {
            merged.keySet().removeAll(FIELD_OPTIONS);
        } else if (hasFields) {
            merged.keySet().removeAll(STYLE_OPTIONS);
        } else if (merged.keySet().stream().noneMatch(k -> STYLE_OPTIONS.contains(k) || FIELD_OPTIONS.contains(k))) {
            merged.put("dateStyle", "medium");
            merged.put("timeStyle", "short");
        }
        merged.putAll(given);
        if (exprOptions.get("locale") != null) {
            merged.put("locale", exprOptions.get("locale"));
        }
        return DateTimeResults.toValue(ctx, input, merged);
    }
}
