package io.messageformat.core.part;

import io.messageformat.core.bidi.Direction;
import java.util.List;

/**
 * Output of a number value. {@link #value()} is the full rendered string; {@link #parts()} breaks
 * it down into sign, digits, separators and adornments, in display order.
 */
public record NumberPart(String value, String source, String locale, Direction dir, List<NumberSubPart> parts)
        implements MessagePart {

    /** Canonical constructor with defensive copies. */
    public NumberPart {
        parts = parts != null ? List.copyOf(parts) : List.of();
    }

    @Override
    public String type() {
        return "number";
    }
}
