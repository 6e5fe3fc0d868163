package io.messageformat.core.part;

import io.messageformat.core.bidi.Direction;

/** Output of a string value. */
public record StringPart(String value, String source, String locale, Direction dir) implements MessagePart {

    @Override
    public String type() {
        return "string";
    }
}
