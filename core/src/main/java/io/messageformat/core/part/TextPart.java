package io.messageformat.core.part;

/** Literal pattern text. */
public record TextPart(String value) implements MessagePart {

    public TextPart {
        value = value != null ? value : "";
    }

    @Override
    public String type() {
        return "text";
    }
}
