package io.messageformat.core.value;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.locale.LocaleTags;
import io.messageformat.core.part.DateTimePart;
import io.messageformat.core.part.MessagePart;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A date/time with its resolved formatting options. Not selectable.
 *
 * <p>Formatting uses either the field options ({@code dateFields}, {@code dateLength}, {@code
 * timePrecision}, {@code timeZoneStyle}) or the style options ({@code dateStyle}, {@code
 * timeStyle}), which map to the JDK's localized {@link FormatStyle}s.
 */
public final class DateTimeValue implements MessageValue {

    private static final String DEFAULT_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private final ZonedDateTime value;
    private final boolean zoned;
    private final String locale;
    private final String source;
    private final Direction dir;
    private final Map<String, Object> options;

    public DateTimeValue(ZonedDateTime value, String locale, String source, Map<String, Object> options) {
        this(value, true, locale, source, Direction.AUTO, options);
    }

    /**
     * @param zoned whether the time zone of {@code value} was given by the operand or a {@code
     *              timeZone} option, rather than assumed
     */
    public DateTimeValue(
            ZonedDateTime value,
            boolean zoned,
            String locale,
            String source,
            Direction dir,
            Map<String, Object> options) {
        this.value = Objects.requireNonNull(value, "value");
        this.zoned = zoned;
        this.locale = locale != null ? locale : "";
        this.source = source != null ? source : "";
        this.dir = dir != null ? dir : Direction.AUTO;
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }

    @Override
    public String type() {
        return "datetime";
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public Direction dir() {
        return dir;
    }

    @Override
    public String locale() {
        return locale;
    }

    @Override
    public Map<String, Object> options() {
        return options;
    }

    /** Whether the time zone is known rather than assumed. */
    public boolean zoned() {
        return zoned;
    }

    @Override
    public String toString() {
        return formatter().format(value);
    }

    @Override
    public List<MessagePart> toParts() {
        return List.of(new DateTimePart(toString(), source, locale, dir));
    }

    @Override
    public ZonedDateTime valueOf() {
        return value;
    }

    private DateTimeFormatter formatter() {
        Locale loc = LocaleTags.toLocale(locale);
        String dateFields = text("dateFields");
        String timePrecision = text("timePrecision");
        if (dateFields != null || timePrecision != null) {
            return DateTimeFormatter.ofPattern(fieldPattern(dateFields, timePrecision), loc);
        }
        FormatStyle dateStyle = style(text("dateStyle"));
        FormatStyle timeStyle = style(text("timeStyle"));
        if (dateStyle != null && timeStyle != null) {
            return DateTimeFormatter.ofLocalizedDateTime(dateStyle, timeStyle).withLocale(loc);
        }
        if (dateStyle != null) {
            return DateTimeFormatter.ofLocalizedDate(dateStyle).withLocale(loc);
        }
        if (timeStyle != null) {
            return DateTimeFormatter.ofLocalizedTime(timeStyle).withLocale(loc);
        }
        return DateTimeFormatter.ofPattern(DEFAULT_PATTERN, loc);
    }

    /**
     * Builds a pattern from the field options, e.g. {@code dateFields=year-month-day} with {@code
     * dateLength=long} → {@code "yyyy MMMM d"}.
     */
    String fieldPattern(String dateFields, String timePrecision) {
        List<String> parts = new ArrayList<>();
        if (dateFields != null) {
            Set<String> fields = Set.of(dateFields.split("-"));
            String length = text("dateLength") != null ? text("dateLength") : "medium";
            if (fields.contains("weekday")) {
                parts.add("long".equals(length) ? "EEEE," : "EEE,");
            }
            if (fields.contains("year")) {
                parts.add("yyyy");
            }
            if (fields.contains("month")) {
                parts.add("long".equals(length) ? "MMMM" : "short".equals(length) ? "M" : "MMM");
            }
            if (fields.contains("day")) {
                parts.add("d");
            }
        }
        if (timePrecision != null) {
            parts.add(timePattern(timePrecision));
        }
        String zoneStyle = text("timeZoneStyle");
        if ("long".equals(zoneStyle)) {
            parts.add("zzzz");
        } else if ("short".equals(zoneStyle)) {
            parts.add("z");
        }
        return parts.isEmpty() ? DEFAULT_PATTERN : String.join(" ", parts);
    }

    private String timePattern(String precision) {
        boolean hour24 = Boolean.FALSE.equals(options.get("hour12"));
        String hour = hour24 ? "HH" : "h";
        String suffix = hour24 ? "" : " a";
        return switch (precision) {
            case "hour" -> hour + suffix;
            case "second" -> hour + ":mm:ss" + fractionalSeconds() + suffix;
            default -> hour + ":mm" + suffix;
        };
    }

    private String fractionalSeconds() {
        Object digits = options.get("fractionalSecondDigits");
        return digits instanceof Integer n && n > 0 ? "." + "S".repeat(Math.min(n, 9)) : "";
    }

    private String text(String name) {
        Object option = options.get(name);
        return option instanceof String s ? s : null;
    }

    private static FormatStyle style(String name) {
        if (name == null) {
            return null;
        }
        return switch (name) {
            case "full" -> FormatStyle.FULL;
            case "long" -> FormatStyle.LONG;
            case "medium" -> FormatStyle.MEDIUM;
            case "short" -> FormatStyle.SHORT;
            default -> null;
        };
    }
}
