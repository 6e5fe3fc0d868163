package io.messageformat.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A placeholder: an optional argument, an optional function and attributes. At least one of
 * {@code arg} and {@code functionRef} is normally present. Attribute values are {@link Literal}s,
 * or {@link Boolean#TRUE} for an attribute given without a value.
 */
public record Expression(Argument arg, FunctionRef functionRef, Map<String, Object> attributes)
        implements PatternElement {

    public Expression {
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    public Expression(Argument arg, FunctionRef functionRef) {
        this(arg, functionRef, Map.of());
    }
}
