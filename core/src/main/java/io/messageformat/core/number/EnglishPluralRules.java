package io.messageformat.core.number;

import java.math.BigDecimal;

/**
 * English plural rules.
 *
 * <pre>
 * cardinal: 1 → one, everything else → other
 * ordinal:  n % 100 in 11..13 → other; n % 10 == 1 → one, 2 → two, 3 → few; else other
 * </pre>
 *
 * Ordinals use the integer part of the number.
 */
final class EnglishPluralRules implements PluralRules {

    static final EnglishPluralRules INSTANCE = new EnglishPluralRules();

    private EnglishPluralRules() {}

    @Override
    public PluralCategory cardinal(BigDecimal number) {
        return number.compareTo(BigDecimal.ONE) == 0 ? PluralCategory.ONE : PluralCategory.OTHER;
    }

    @Override
    public PluralCategory ordinal(BigDecimal number) {
        long n = number.longValue();
        long mod100 = n % 100;
        if (mod100 >= 11 && mod100 <= 13) {
            return PluralCategory.OTHER;
        }
        return switch ((int) (n % 10)) {
            case 1 -> PluralCategory.ONE;
            case 2 -> PluralCategory.TWO;
            case 3 -> PluralCategory.FEW;
            default -> PluralCategory.OTHER;
        };
    }
}
