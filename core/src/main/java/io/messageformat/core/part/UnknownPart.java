package io.messageformat.core.part;

/** Output of an operand no function could classify; carries the raw value. */
public record UnknownPart(Object value, String source, String locale) implements MessagePart {

    @Override
    public String type() {
        return "unknown";
    }
}
