package io.messageformat.core.function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.messageformat.core.error.ErrorType;
import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.number.Numbers;
import io.messageformat.core.value.FallbackValue;
import io.messageformat.core.value.MessageValue;
import java.util.Map;

/**
 * Reads the operand of a numeric function.
 *
 * <p>A resolved {@link MessageValue} is unwrapped and its options are carried along. Strings must
 * be JSON numbers ({@code "42"}, {@code "-1.5e3"}); whitespace or trailing characters are
 * rejected. Everything else must already be a supported {@link Number}.
 */
public final class NumericOperand {

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private NumericOperand() {
        // utility class
    }

    /**
     * @throws MessageResolutionException with type {@code bad-operand} when the operand is not
     *     numeric
     */
    public static NumericInput read(Object operand, String source) {
        Object value = operand;
        Map<String, Object> options = null;
        if (value instanceof MessageValue resolved) {
            if (resolved instanceof FallbackValue) {
                throw MessageResolutionException.badOperand("Input is not numeric", source);
            }
            options = resolved.options();
            value = resolved.valueOf();
        }
        if (value instanceof String text) {
            value = parse(text, source);
        }
        if (!(value instanceof Number number) || !Numbers.isSupported(number)) {
            throw MessageResolutionException.badOperand("Input is not numeric", source);
        }
        return new NumericInput(number, options);
    }

    private static Number parse(String text, String source) {
        if (text.isEmpty() || Character.isWhitespace(text.charAt(0))
                || Character.isWhitespace(text.charAt(text.length() - 1))) {
            throw MessageResolutionException.badOperand("Input is not numeric", source);
        }
        try {
            JsonNode node = JSON.readTree(text);
            if (node == null || !node.isNumber()) {
                throw MessageResolutionException.badOperand("Input is not numeric", source);
            }
            if (node.isInt()) {
                return node.intValue();
            }
            if (node.isLong()) {
                return node.longValue();
            }
            if (node.isBigInteger()) {
                return node.bigIntegerValue();
            }
            return node.decimalValue();
        } catch (JsonProcessingException e) {
            throw new MessageResolutionException(ErrorType.BAD_OPERAND, "Input is not numeric", e, source);
        }
    }
}
