package io.messageformat.core.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.messageformat.core.error.MessageSelectionException;
import io.messageformat.core.part.FallbackPart;
import io.messageformat.core.part.UnknownPart;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FallbackAndUnknownValueTest {

    @Nested
    @DisplayName("FallbackValue")
    class Fallback {

        private final FallbackValue value = new FallbackValue("$missing", "en");

        @Test
        void rendersSourceInBraces() {
            assertThat(value.toString()).isEqualTo("{$missing}");
            assertThat(value.type()).isEqualTo("fallback");
        }

        @Test
        void partCarriesSource() {
            assertThat(value.toParts()).containsExactly(new FallbackPart("$missing", "en"));
            assertThat(value.toParts().get(0).value()).isEqualTo("{$missing}");
        }

        @Test
        void neverSelectable() {
            assertThat(value.selectable()).isFalse();
            assertThatThrownBy(() -> value.selectKeys(List.of("other")))
                    .isInstanceOf(MessageSelectionException.class)
                    .hasMessageContaining("fallback");
        }
    }

    @Nested
    @DisplayName("UnknownValue")
    class Unknown {

        private final Object raw = new Object() {
            @Override
            public String toString() {
                return "opaque";
            }
        };

        private final UnknownValue value = new UnknownValue("$thing", raw, "en");

        @Test
        void preservesRawValue() {
            assertThat(value.valueOf()).isSameAs(raw);
            assertThat(value.toString()).isEqualTo("opaque");
            assertThat(value.toParts()).containsExactly(new UnknownPart(raw, "$thing", "en"));
        }

        @Test
        void neverSelectable() {
            assertThatThrownBy(() -> value.selectKeys(List.of("other"))).isInstanceOf(MessageSelectionException.class);
        }

        @Test
        void nullValueRendersAsNull() {
            assertThat(new UnknownValue("$x", null, "en").toString()).isEqualTo("null");
        }
    }
}
