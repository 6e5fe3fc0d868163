package io.messageformat.core.function;

import io.messageformat.core.error.ErrorType;
import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.value.DateTimeValue;
import io.messageformat.core.value.MessageValue;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

/** Time zone resolution and result construction shared by the date/time functions. */
final class DateTimeResults {

    static final String[] STYLES = {"full", "long", "medium", "short"};

    private DateTimeResults() {
        // utility class
    }

    /**
     * Applies the {@code timeZone} option and builds the value.
     *
     * <p>{@code timeZone=input} keeps the operand's zone. Any other zone converts operands that
     * carry none; for an operand with its own, different zone the conversion is unsupported and
     * a fallback is returned.
     */
    static MessageValue toValue(FunctionContext ctx, DateTimeInput input, Map<String, Object> options) {
        ZonedDateTime value = input.value();
        boolean zoned = input.zoned();
        Object timeZone = options.get("timeZone");
        if (timeZone instanceof String id && !"input".equals(id)) {
            ZoneId zone;
            try {
                zone = ZoneId.of(id);
            } catch (DateTimeException e) {
                ctx.onError(new MessageResolutionException(
                        ErrorType.BAD_OPTION,
                        "Value " + timeZone + " is not a valid time zone",
                        e,
                        ctx.source()));
                options.remove("timeZone");
                zone = null;
            }
            if (zone != null) {
                if (zoned && !value.getZone().normalized().equals(zone.normalized())) {
                    ctx.onError(MessageResolutionException.unsupportedOperation(
                            "Time zone conversion is not supported", ctx.source()));
                    return NumberResults.fallback(ctx);
                }
                value = input.absolute() ? value.withZoneSameInstant(zone) : value.withZoneSameLocal(zone);
                zoned = true;
            }
        }
        String locale = NumberResults.locale(ctx, options);
        options.remove("locale");
        return new DateTimeValue(value, zoned, locale, ctx.source(), ctx.dir(), options);
    }
}
