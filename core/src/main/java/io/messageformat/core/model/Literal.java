package io.messageformat.core.model;

import java.util.Objects;

/** A literal value; quoting is a syntax concern and is not kept. */
public record Literal(String value) implements Argument, VariantKey {

    public Literal {
        Objects.requireNonNull(value, "value");
    }
}
