package io.messageformat.core.function;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.bidi.DirectionResolver;
import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.value.FallbackValue;
import io.messageformat.core.value.NumberValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Option merging and result construction shared by the numeric functions. */
final class NumberResults {

    static final Set<String> SELECT_VALUES = Set.of("exact", "cardinal", "ordinal");

    private NumberResults() {
        // utility class
    }

    /** Operand options, then the locale matcher and {@code style}. Expression options go on top. */
    static Map<String, Object> baseOptions(FunctionContext ctx, NumericInput input, String style) {
        Map<String, Object> merged = new LinkedHashMap<>(input.options());
        merged.put("localeMatcher", ctx.localeMatcher());
        merged.put("style", style);
        return merged;
    }

    /**
     * Builds the number value. When {@code canSelect} is set, a {@code select} expression option
     * must have been written as a literal: otherwise it is reported and selection is disabled.
     */
    static NumberValue toValue(
            FunctionContext ctx,
            Number value,
            Map<String, Object> options,
            Map<String, Object> exprOptions,
            boolean canSelect) {
        if (canSelect && exprOptions.get("select") != null) {
            if (!ctx.isLiteral("select")) {
                ctx.onError(MessageResolutionException.badOption(
                        "The option select may only be set by a literal value", ctx.source()));
                canSelect = false;
            } else {
                Object select = options.get("select");
                if (select instanceof String && !SELECT_VALUES.contains(select)) {
                    ctx.onError(MessageResolutionException.badOption(
                            "Invalid select value: " + select, ctx.source()));
                    options.remove("select");
                }
            }
        }
        String locale = locale(ctx, exprOptions);
        return new NumberValue(value, locale, ctx.source(), direction(ctx, locale), options, canSelect);
    }

    static FallbackValue fallback(FunctionContext ctx) {
        return new FallbackValue(ctx.source(), ctx.firstLocale());
    }

    /** The {@code locale} expression option if it is a non-empty string, else the first context locale. */
    static String locale(FunctionContext ctx, Map<String, Object> exprOptions) {
        Object locale = exprOptions != null ? Coercions.unwrap(exprOptions.get("locale")) : null;
        if (locale instanceof String tag && !tag.isBlank()) {
            return tag;
        }
        return ctx.firstLocale();
    }

    static Direction direction(FunctionContext ctx, String locale) {
        return ctx.dir() != null ? ctx.dir() : DirectionResolver.getLocaleDirection(locale);
    }
}
