package io.messageformat.core.function;

import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.FallbackValue;
import io.messageformat.core.value.MessageValue;
import io.messageformat.core.value.UnknownValue;
import java.util.Map;

/** The built-in function tables. Both are immutable. */
public final class BuiltinFunctions {

    /** Replaces an empty source in fallback values. */
    public static final String REPLACEMENT = "\uFFFD";

    /** {@code :integer}, {@code :number}, {@code :offset} and {@code :string}. */
    public static final Map<String, MessageFunction> STABLE = Map.of(
            "integer", new IntegerFunction(),
            "number", new NumberFunction(),
            "offset", new OffsetFunction(),
            "string", new StringFunction());

    /** Functions whose definitions are not final yet. */
    public static final Map<String, MessageFunction> DRAFT = Map.of(
            "currency", new CurrencyFunction(),
            "date", new DateFunction(),
            "datetime", new DateTimeFunction(),
            "math", new MathFunction(),
            "percent", new PercentFunction(),
            "time", new TimeFunction(),
            "unit", new UnitFunction());

    private BuiltinFunctions() {
        // utility class
    }

    /** Fallback for an expression; an empty source renders as <code>{U+FFFD}</code>. */
    public static MessageValue fallback(String source, String locale) {
        return new FallbackValue(source == null || source.isEmpty() ? REPLACEMENT : source, locale);
    }

    /** Wraps an operand that no function handles. */
    public static MessageValue unknown(String source, Object input, String locale) {
        return new UnknownValue(source, input, locale);
    }
}
