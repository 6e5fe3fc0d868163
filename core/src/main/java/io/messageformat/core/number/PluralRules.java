package io.messageformat.core.number;

import java.math.BigDecimal;

/**
 * Maps a number to its plural category.
 *
 * <p>Only a simplified English rule set ships with the engine and it is used for every locale.
 * This is an approximation for selection fallback, not a CLDR plural-rule engine.
 */
public interface PluralRules {

    /** Cardinal category, as in "1 file" / "2 files". */
    PluralCategory cardinal(BigDecimal number);

    /** Ordinal category, as in "1st", "2nd", "3rd", "4th". */
    PluralCategory ordinal(BigDecimal number);

    /** Returns the rules used for {@code locale}. */
    static PluralRules forLocale(String locale) {
        return EnglishPluralRules.INSTANCE;
    }
}
