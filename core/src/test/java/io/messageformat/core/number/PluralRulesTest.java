package io.messageformat.core.number;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PluralRulesTest {

    private final PluralRules rules = PluralRules.forLocale("en");

    @Test
    void cardinalOneIsExactlyOne() {
        assertThat(rules.cardinal(BigDecimal.ONE)).isEqualTo(PluralCategory.ONE);
        assertThat(rules.cardinal(new BigDecimal("1.0"))).isEqualTo(PluralCategory.ONE);
        assertThat(rules.cardinal(BigDecimal.ZERO)).isEqualTo(PluralCategory.OTHER);
        assertThat(rules.cardinal(new BigDecimal("1.5"))).isEqualTo(PluralCategory.OTHER);
    }

    @Test
    void ordinalUsesIntegerPart() {
        assertThat(rules.ordinal(new BigDecimal("2.7"))).isEqualTo(PluralCategory.TWO);
        assertThat(rules.ordinal(new BigDecimal("111"))).isEqualTo(PluralCategory.OTHER);
        assertThat(rules.ordinal(new BigDecimal("23"))).isEqualTo(PluralCategory.FEW);
    }

    @Test
    void everyLocaleSharesTheSimplifiedRules() {
        assertThat(PluralRules.forLocale("pl")).isSameAs(PluralRules.forLocale("en-US"));
    }

    @Test
    void categoryValuesAreLowerCase() {
        assertThat(PluralCategory.FEW.value()).isEqualTo("few");
        assertThat(PluralCategory.OTHER.value()).isEqualTo("other");
    }
}
