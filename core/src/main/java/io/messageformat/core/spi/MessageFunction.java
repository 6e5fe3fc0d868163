package io.messageformat.core.spi;

import io.messageformat.core.value.MessageValue;
import java.util.Map;

/**
 * A formatting function, such as {@code :number} or a host-provided custom function. Functions
 * are registered by name in a {@code FunctionRegistry} and invoked once per expression.
 *
 * <p>Implementations must not throw for problems with the operand or options. They report
 * errors to {@link FunctionContext#onError(io.messageformat.core.error.MessageFormatException)}
 * and return a value, falling back to a {@code FallbackValue} when no sensible value exists.
 */
@FunctionalInterface
public interface MessageFunction {

    /**
     * Resolves {@code operand} with {@code options}.
     *
     * @param ctx     the execution context of the expression
     * @param options expression options; values are literals, resolved variable values or
     *                {@link MessageValue}s
     * @param operand the operand, or {@code null} when the expression has none
     * @return the resolved value, never {@code null}
     */
    MessageValue call(FunctionContext ctx, Map<String, Object> options, Object operand);
}
