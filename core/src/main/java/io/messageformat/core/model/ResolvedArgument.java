package io.messageformat.core.model;

import io.messageformat.core.value.MessageValue;
import java.util.Objects;

/**
 * An operand that has already been resolved, e.g. the value bound to a declaration. Functions
 * receive the wrapped value as their operand and inherit its options.
 */
public record ResolvedArgument(MessageValue value) implements Argument {

    public ResolvedArgument {
        Objects.requireNonNull(value, "value");
    }
}
