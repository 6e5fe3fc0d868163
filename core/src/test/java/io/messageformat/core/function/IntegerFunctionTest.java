package io.messageformat.core.function;

import static org.assertj.core.api.Assertions.assertThat;

import io.messageformat.core.error.ErrorType;
import io.messageformat.core.error.MessageFormatException;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.value.FallbackValue;
import io.messageformat.core.value.MessageValue;
import io.messageformat.core.value.NumberValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IntegerFunctionTest {

    private final IntegerFunction integer = new IntegerFunction();
    private final List<MessageFormatException> errors = new ArrayList<>();
    private final FunctionContext ctx = FunctionContext.builder().source("$i").onError(errors::add).build();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "4.5, 5",
        "4.4, 4",
        "-4.5, -5",
        "-0.6, -1",
        "1234.6, '1,235'",
        "7, 7"
    })
    void roundsHalfAwayFromZero(String operand, String expected) {
        MessageValue value = integer.call(ctx, Map.of(), operand);

        assertThat(value.toString()).isEqualTo(expected);
        assertThat(errors).isEmpty();
    }

    @Test
    void roundKeepsIntegralTypes() {
        assertThat(IntegerFunction.round(7)).isEqualTo(7);
        assertThat(IntegerFunction.round(7L)).isEqualTo(7L);
        assertThat(IntegerFunction.round(BigInteger.TEN)).isEqualTo(BigInteger.TEN);
        assertThat(IntegerFunction.round(2.5d)).isEqualTo(3L);
        assertThat(IntegerFunction.round(new BigDecimal("-2.5"))).isEqualTo(new BigDecimal("-3"));
        assertThat(IntegerFunction.round(Double.NaN)).isEqualTo(Double.NaN);
    }

    @Test
    void valueIsTheRoundedNumber() {
        assertThat(integer.call(ctx, Map.of(), 2.7d).valueOf()).isEqualTo(3L);
    }

    @Test
    void dropsInheritedFractionDigits() {
        NumberValue operand = new NumberValue(new BigDecimal("3.25"), "en-US", "$x", Map.of("minimumFractionDigits", 2));

        MessageValue value = integer.call(ctx, Map.of(), operand);

        assertThat(value.toString()).isEqualTo("3");
        assertThat(value.options()).doesNotContainKey("minimumFractionDigits").containsEntry("maximumFractionDigits", 0);
    }

    @Test
    void fractionOptionsAreNotAccepted() {
        MessageValue value = integer.call(ctx, Map.of("maximumFractionDigits", "3"), 1);

        assertThat(value.options()).containsEntry("maximumFractionDigits", 0);
        assertThat(errors).isEmpty();
    }

    @Test
    void selectsOnTheRoundedValue() {
        MessageValue value = integer.call(ctx, Map.of(), 0.6d);

        assertThat(value.selectKeys(List.of("=1", "one", "other"))).containsExactly("=1");
    }

    @Test
    void nonNumericOperandFallsBack() {
        MessageValue value = integer.call(ctx, Map.of(), "one");

        assertThat(value).isInstanceOf(FallbackValue.class);
        assertThat(errors).singleElement().extracting(MessageFormatException::type).isEqualTo(ErrorType.BAD_OPERAND);
    }
}
