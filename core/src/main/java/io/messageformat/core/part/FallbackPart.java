package io.messageformat.core.part;

/** Output of an expression that could not be resolved; renders as <code>{source}</code>. */
public record FallbackPart(String source, String locale) implements MessagePart {

    public FallbackPart {
        source = source != null ? source : "";
        locale = locale != null ? locale : "";
    }

    @Override
    public String type() {
        return "fallback";
    }

    @Override
    public Object value() {
        return "{" + source + "}";
    }
}
