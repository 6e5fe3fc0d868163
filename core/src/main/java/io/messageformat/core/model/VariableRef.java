package io.messageformat.core.model;

import java.util.Objects;

/** Reference to a variable, without the {@code $} sigil. */
public record VariableRef(String name) implements Argument {

    public VariableRef {
        Objects.requireNonNull(name, "name");
    }
}
