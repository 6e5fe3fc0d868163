package io.messageformat.core.value;

import static org.assertj.core.api.Assertions.assertThat;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.part.StringPart;
import java.util.List;
import org.junit.jupiter.api.Test;

class StringValueTest {

    @Test
    void valueIsReturnedUnchanged() {
        var value = new StringValue("hello", "en", "$greeting");

        assertThat(value.type()).isEqualTo("string");
        assertThat(value.toString()).isEqualTo("hello");
        assertThat(value.valueOf()).isEqualTo("hello");
        assertThat(value.source()).isEqualTo("$greeting");
        assertThat(value.dir()).isEqualTo(Direction.AUTO);
        assertThat(value.options()).isEmpty();
    }

    @Test
    void toPartsProducesSingleStringPart() {
        var value = new StringValue("hello", "en", "$greeting", Direction.LTR);

        assertThat(value.toParts()).containsExactly(new StringPart("hello", "$greeting", "en", Direction.LTR));
    }

    @Test
    void selectsExactMatch() {
        var value = new StringValue("male", "en", "$gender");

        assertThat(value.selectable()).isTrue();
        assertThat(value.selectKeys(List.of("female", "male", "other"))).containsExactly("male");
        assertThat(value.selectKeys(List.of("Male"))).isEmpty();
    }

    @Test
    void selectionNormalizesToNfc() {
        // U+0065 U+0301 (decomposed é) against the precomposed U+00E9
        var value = new StringValue("cafe\u0301", "fr", "$word");

        assertThat(value.selectKeys(List.of("caf\u00e9"))).containsExactly("caf\u00e9");
    }

    @Test
    void noPluralLogic() {
        var value = new StringValue("1", "en", "$n");

        assertThat(value.selectKeys(List.of("one", "other"))).isEmpty();
    }
}
