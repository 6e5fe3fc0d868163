package io.messageformat.core.part;

import io.messageformat.core.bidi.Direction;

/** Output of a date/time value. */
public record DateTimePart(String value, String source, String locale, Direction dir) implements MessagePart {

    @Override
    public String type() {
        return "datetime";
    }
}
