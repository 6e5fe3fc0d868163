package io.messageformat.core.function;

import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.Map;

/** {@code :offset add=N} or {@code :offset subtract=N}, formatted like {@code :number}. */
public final class OffsetFunction implements MessageFunction {

    @Override
    public MessageValue call(FunctionContext ctx, Map<String, Object> options, Object operand) {
        return NumericDelta.apply("offset", ctx, options, operand);
    }
}
