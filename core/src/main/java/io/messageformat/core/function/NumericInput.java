package io.messageformat.core.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A numeric operand and the formatting options it carried in, if it was an already resolved
 * value.
 */
public record NumericInput(Number value, Map<String, Object> options) {

    public NumericInput {
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }
}
