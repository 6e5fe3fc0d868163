package io.messageformat.core.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.bidi.DirectionResolver;
import io.messageformat.core.error.ErrorType;
import io.messageformat.core.error.MessageSelectionException;
import io.messageformat.core.part.BidiIsolationPart;
import io.messageformat.core.part.NumberPart;
import io.messageformat.core.part.NumberSubPart;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NumberValueTest {

    @Test
    void valueOfIsTheRawNumberForPercent() {
        var value = new NumberValue(0.01, "en-US", "$p", Map.of("style", "percent"));

        assertThat(value.valueOf()).isEqualTo(0.01);
        assertThat(value.toString()).isEqualTo("1%");
    }

    @Test
    void toPartsCarriesSubParts() {
        var value = new NumberValue(1234.5, "en-US", "$n", Direction.LTR, Map.of(), true);

        List<?> parts = value.toParts();

        assertThat(parts).hasSize(1);
        NumberPart part = (NumberPart) parts.get(0);
        assertThat(part.value()).isEqualTo("1,234.5");
        assertThat(part.source()).isEqualTo("$n");
        assertThat(part.dir()).isEqualTo(Direction.LTR);
        assertThat(part.parts()).extracting(NumberSubPart::type).containsExactly("integer", "decimal", "fraction");
    }

    @Test
    void optionsAreImmutableSnapshot() {
        Map<String, Object> options = new HashMap<>(Map.of("minimumFractionDigits", 2));
        var value = new NumberValue(1, "en-US", "$n", options);

        options.put("minimumFractionDigits", 5);

        assertThat(value.options()).containsEntry("minimumFractionDigits", 2);
        assertThat(value.toString()).isEqualTo("1.00");
        assertThatThrownBy(() -> value.options().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void selectableValueSelects() {
        var value = new NumberValue(1, "en-US", "$n", Map.of());

        assertThat(value.selectable()).isTrue();
        assertThat(value.selectKeys(List.of("one", "other"))).containsExactly("one");
    }

    @Test
    void nonSelectableValueThrowsBadSelector() {
        var value = new NumberValue(1, "en-US", "$n", Direction.LTR, Map.of(), false);

        assertThat(value.selectable()).isFalse();
        assertThatThrownBy(() -> value.selectKeys(List.of("one")))
                .isInstanceOfSatisfying(
                        MessageSelectionException.class, e -> assertThat(e.type()).isEqualTo(ErrorType.BAD_SELECTOR));
    }

    @Test
    void isolatedPartsWrapInDirectionIsolate() {
        var value = new NumberValue(5, "ar", "$n", Direction.RTL, Map.of(), true);

        var parts = value.toIsolatedParts();

        assertThat(parts).hasSize(3);
        assertThat(parts.get(0)).isEqualTo(new BidiIsolationPart(String.valueOf(DirectionResolver.RLI)));
        assertThat(parts.get(2)).isEqualTo(new BidiIsolationPart(String.valueOf(DirectionResolver.PDI)));
        assertThat(parts.get(0).type()).isEqualTo("bidiIsolation");
    }
}
