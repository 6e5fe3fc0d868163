package io.messageformat.core.model;

import java.util.List;
import java.util.Objects;

/** Keys, one per selector, and the pattern used when they match. */
public record Variant(List<VariantKey> keys, Pattern value) {

    public Variant {
        keys = keys != null ? List.copyOf(keys) : List.of();
        Objects.requireNonNull(value, "value");
    }

    /** Whether every key is the catchall. */
    public boolean isFallback() {
        return keys.stream().allMatch(CatchallKey.class::isInstance);
    }
}
