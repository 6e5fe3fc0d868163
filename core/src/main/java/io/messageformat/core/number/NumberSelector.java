package io.messageformat.core.number;

import java.math.BigDecimal;
import java.util.List;

/**
 * Variant key matching for numeric values.
 *
 * <p>Order: an {@code =N} key numerically equal to the value, then a key equal to the value's
 * canonical string, then (unless {@code select=exact}) the plural category. Percent values are
 * matched on their displayed magnitude, i.e. scaled by 100.
 */
public final class NumberSelector {

    private NumberSelector() {
        // utility class
    }

    /**
     * Returns the matching key as a one-element list, or an empty list when nothing matches.
     *
     * @param locale BCP 47 tag used for plural rules
     */
    public static List<String> selectKeys(Number value, NumberOptions options, String locale, List<String> keys) {
        PluralRules rules = PluralRules.forLocale(locale);
        boolean ordinal = "ordinal".equals(options.select());

        if (!Numbers.isFinite(value)) {
            if ("exact".equals(options.select())) {
                return List.of();
            }
            String other = PluralCategory.OTHER.value();
            return keys.contains(other) ? List.of(other) : List.of();
        }

        BigDecimal effective = Numbers.toBigDecimal(value);
        if (options.isPercent()) {
            effective = effective.movePointRight(2);
        }

        for (String key : keys) {
            if (key.startsWith("=") && matchesExact(key.substring(1), effective)) {
                return List.of(key);
            }
        }

        String canonical = Numbers.canonical(effective);
        for (String key : keys) {
            if (key.equals(canonical)) {
                return List.of(key);
            }
        }

        if ("exact".equals(options.select())) {
            return List.of();
        }

        PluralCategory category = ordinal ? rules.ordinal(effective) : rules.cardinal(effective);
        if (keys.contains(category.value())) {
            return List.of(category.value());
        }
        return List.of();
    }

    private static boolean matchesExact(String literal, BigDecimal value) {
        try {
            return new BigDecimal(literal).compareTo(value) == 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
