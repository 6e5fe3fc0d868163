package io.messageformat.core.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class OptionKeysTest {

    @ParameterizedTest
    @ValueSource(strings = {"minimumFractionDigits", "a", "u-dir", "snake_case", "x1"})
    void acceptsIdentifierKeys(String key) {
        assertThatCode(() -> OptionKeys.validate(key)).doesNotThrowAnyException();
        assertThat(OptionKeys.isValid(key)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "has space", "a.b", "ns:name", "__proto__", "Constructor", "PROTOTYPE", "__defineGetter__"})
    void rejectsBadKeys(String key) {
        assertThat(OptionKeys.isValid(key)).isFalse();
        assertThatThrownBy(() -> OptionKeys.validate(key)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNullAndOverlongKeys() {
        assertThat(OptionKeys.isValid(null)).isFalse();
        assertThat(OptionKeys.isValid("k".repeat(OptionKeys.MAX_KEY_LENGTH))).isTrue();
        assertThatThrownBy(() -> OptionKeys.validate("k".repeat(OptionKeys.MAX_KEY_LENGTH + 1)))
                .hasMessageContaining("too long");
    }

    @Test
    void messageNamesTheOffendingCharacter() {
        assertThatThrownBy(() -> OptionKeys.validate("a.b"))
                .hasMessage("Invalid character '.' at position 1 in option key 'a.b'");
    }

    @Test
    void validateAllLimitsCount() {
        Map<String, Object> options = new HashMap<>();
        for (int i = 0; i <= OptionKeys.MAX_OPTIONS; i++) {
            options.put("k" + i, i);
        }

        assertThatThrownBy(() -> OptionKeys.validateAll(options)).hasMessageStartingWith("Too many options");
        assertThatCode(() -> OptionKeys.validateAll(null)).doesNotThrowAnyException();
    }

    @Test
    void validateAllWrapsFirstProblem() {
        assertThatThrownBy(() -> OptionKeys.validateAll(Map.of("bad key", 1)))
                .hasMessageStartingWith("Invalid option: ")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sanitizeDropsInvalidKeysAndKeepsOrder() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("b", 1);
        options.put("__proto__", 2);
        options.put("a", 3);

        assertThat(OptionKeys.sanitize(options)).containsExactly(Map.entry("b", 1), Map.entry("a", 3));
        assertThat(OptionKeys.sanitize(null)).isEmpty();
    }
}
