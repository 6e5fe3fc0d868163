package io.messageformat.core.number;

import java.util.Map;

/**
 * Typed view of the resolved formatting options of a number value. Built from the merged option
 * map a numeric function produces; entries that are absent or of the wrong shape fall back to
 * their defaults.
 *
 * <p>Digit options are {@code null} when not set, so that style defaults and heuristics can
 * apply.
 */
public record NumberOptions(
        String style,
        String currency,
        String currencyDisplay,
        String currencySign,
        String unit,
        String unitDisplay,
        Integer minimumIntegerDigits,
        Integer minimumFractionDigits,
        Integer maximumFractionDigits,
        Integer minimumSignificantDigits,
        Integer maximumSignificantDigits,
        boolean useGrouping,
        String signDisplay,
        String roundingMode,
        String trailingZeroDisplay,
        String select) {

    public static final String DECIMAL = "decimal";
    public static final String PERCENT = "percent";
    public static final String CURRENCY = "currency";
    public static final String UNIT = "unit";

    /** Reads a resolved option map. */
    public static NumberOptions from(Map<String, Object> options) {
        Map<String, Object> o = options != null ? options : Map.of();
        return new NumberOptions(
                text(o, "style", DECIMAL),
                text(o, "currency", null),
                text(o, "currencyDisplay", "symbol"),
                text(o, "currencySign", "standard"),
                text(o, "unit", null),
                text(o, "unitDisplay", "short"),
                integer(o, "minimumIntegerDigits"),
                integer(o, "minimumFractionDigits"),
                integer(o, "maximumFractionDigits"),
                integer(o, "minimumSignificantDigits"),
                integer(o, "maximumSignificantDigits"),
                grouping(o.get("useGrouping")),
                text(o, "signDisplay", "auto"),
                text(o, "roundingMode", "halfExpand"),
                text(o, "trailingZeroDisplay", "auto"),
                text(o, "select", null));
    }

    public boolean isPercent() {
        return PERCENT.equals(style);
    }

    private static String text(Map<String, Object> options, String name, String defaultValue) {
        Object value = options.get(name);
        return value instanceof String s ? s : defaultValue;
    }

    private static Integer integer(Map<String, Object> options, String name) {
        Object value = options.get(name);
        if (value instanceof Number number
                && (number instanceof Integer || number instanceof Long || number instanceof Short)) {
            long l = number.longValue();
            return l >= 0 && l <= Integer.MAX_VALUE ? (int) l : null;
        }
        return null;
    }

    private static boolean grouping(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String) {
            return !"never".equals(value) && !"false".equals(value);
        }
        return true;
    }
}
