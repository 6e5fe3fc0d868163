package io.messageformat.core.value;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.part.FallbackPart;
import io.messageformat.core.part.MessagePart;
import java.util.List;

/**
 * Marker for an expression that could not be resolved. Renders as <code>{source}</code> so that a
 * message always produces output. Never selectable.
 */
public final class FallbackValue implements MessageValue {

    private final String source;
    private final String locale;
    private final Direction dir;

    public FallbackValue(String source, String locale) {
        this(source, locale, Direction.AUTO);
    }

    public FallbackValue(String source, String locale, Direction dir) {
        this.source = source != null ? source : "";
        this.locale = locale != null ? locale : "";
        this.dir = dir != null ? dir : Direction.AUTO;
    }

    @Override
    public String type() {
        return "fallback";
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public Direction dir() {
        return dir;
    }

    @Override
    public String locale() {
        return locale;
    }

    @Override
    public String toString() {
        return "{" + source + "}";
    }

    @Override
    public List<MessagePart> toParts() {
        return List.of(new FallbackPart(source, locale));
    }

    /** Returns the source text; a fallback has no underlying value. */
    @Override
    public String valueOf() {
        return source;
    }
}
