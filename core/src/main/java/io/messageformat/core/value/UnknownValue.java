package io.messageformat.core.value;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.part.MessagePart;
import io.messageformat.core.part.UnknownPart;
import java.util.List;

/** Wraps an operand of a type no function claims. Keeps the raw value; not selectable. */
public final class UnknownValue implements MessageValue {

    private final String source;
    private final Object value;
    private final String locale;

    public UnknownValue(String source, Object value, String locale) {
        this.source = source != null ? source : "";
        this.value = value;
        this.locale = locale != null ? locale : "";
    }

    @Override
    public String type() {
        return "unknown";
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public Direction dir() {
        return Direction.AUTO;
    }

    @Override
    public String locale() {
        return locale;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public List<MessagePart> toParts() {
        return List.of(new UnknownPart(value, source, locale));
    }

    @Override
    public Object valueOf() {
        return value;
    }
}
