package io.messageformat.core.function;

import io.messageformat.core.spi.FunctionContext;
import io.messageformat.core.spi.MessageFunction;
import io.messageformat.core.value.MessageValue;
import java.util.Map;

/** Draft predecessor of {@link OffsetFunction}, with the same options. */
public final class MathFunction implements MessageFunction {

    @Override
    public MessageValue call(FunctionContext ctx, Map<String, Object> options, Object operand) {
        return NumericDelta.apply("math", ctx, options, operand);
    }
}
