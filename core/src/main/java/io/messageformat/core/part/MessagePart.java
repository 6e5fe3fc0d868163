package io.messageformat.core.part;

import io.messageformat.core.bidi.Direction;

/**
 * One piece of formatted output. A formatted message is a list of parts; each resolved value
 * contributes one or more parts through {@code MessageValue.toParts()}.
 */
public sealed interface MessagePart
        permits TextPart,
                BidiIsolationPart,
                MarkupPart,
                FallbackPart,
                StringPart,
                NumberPart,
                DateTimePart,
                UnknownPart {

    /** Part type identifier, e.g. {@code "text"} or {@code "number"}. */
    String type();

    /** The part's value: the rendered string for most parts, the raw value for unknown parts. */
    Object value();

    /** Source text of the expression the part came from; empty for literal text. */
    default String source() {
        return "";
    }

    /** Locale the part was formatted for; empty when not locale sensitive. */
    default String locale() {
        return "";
    }

    /** Base direction of the part. */
    default Direction dir() {
        return Direction.AUTO;
    }
}
