package io.messageformat.core.model;

import io.messageformat.core.part.TextPart;
import java.util.Objects;

/** Literal text, unescaped. */
public record TextElement(String value) implements PatternElement {

    public TextElement {
        Objects.requireNonNull(value, "value");
    }

    public TextPart toPart() {
        return new TextPart(value);
    }
}
