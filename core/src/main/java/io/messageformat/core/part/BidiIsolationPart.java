package io.messageformat.core.part;

/** A single bidi isolate control character (LRI, RLI, FSI or PDI) inserted around a placeholder. */
public record BidiIsolationPart(String value) implements MessagePart {

    @Override
    public String type() {
        return "bidiIsolation";
    }
}
