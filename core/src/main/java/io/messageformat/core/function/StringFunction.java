package io.messageformat.core.function;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.number.Numbers;
import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import io.messageformat.core.value.StringValue;
import java.util.Map;

/**
 * {@code :string} formats any operand as text and selects by exact (NFC normalized) match.
 * Resolved values contribute their formatted string; a missing operand is the empty string.
 */
public final class StringFunction implements MessageFunction {

    @Override
    public MessageValue call(FunctionContext ctx, Map<String, Object> options, Object operand) {
        String locale = NumberResults.locale(ctx, options);
        Direction dir = ctx.dir() != null ? ctx.dir() : Direction.AUTO;
        return new StringValue(stringify(operand), locale, ctx.source(), dir);
    }

    static String stringify(Object operand) {
        if (operand == null) {
            return "";
        }
        if (operand instanceof MessageValue) {
            return operand.toString();
        }
        if (operand instanceof Number number && Numbers.isSupported(number) && Numbers.isFinite(number)) {
            return Numbers.canonical(Numbers.toBigDecimal(number));
        }
        return String.valueOf(operand);
    }
}
