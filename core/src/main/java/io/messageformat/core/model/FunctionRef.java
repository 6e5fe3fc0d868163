package io.messageformat.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** {@code :name} with its options, in source order. */
public record FunctionRef(String name, Map<String, Argument> options) {

    public FunctionRef {
        Objects.requireNonNull(name, "name");
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }

    public FunctionRef(String name) {
        this(name, Map.of());
    }

    /** Names of options whose value is a literal. */
    public Set<String> literalOptionKeys() {
        Set<String> keys = new LinkedHashSet<>();
        options.forEach((key, value) -> {
            if (value instanceof Literal) {
                keys.add(key);
            }
        });
        return Collections.unmodifiableSet(keys);
    }
}
