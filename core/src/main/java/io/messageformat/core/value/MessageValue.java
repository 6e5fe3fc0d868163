package io.messageformat.core.value;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.bidi.DirectionResolver;
import io.messageformat.core.error.MessageSelectionException;
import io.messageformat.core.part.BidiIsolationPart;
import io.messageformat.core.part.MessagePart;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The resolved result of one expression. Every function returns a {@code MessageValue}; pattern
 * assembly renders it through {@link #toString()} or {@link #toParts()} and variant selection
 * interrogates it through {@link #selectKeys(List)}.
 *
 * <p>Implementations are immutable. {@link #valueOf()} always succeeds and returns the raw value
 * the function was given, untouched by display conventions such as percent scaling.
 */
public interface MessageValue {

    /** Value type: {@code "string"}, {@code "number"}, {@code "datetime"}, {@code "fallback"}, {@code "unknown"} or a custom name. */
    String type();

    /** Source text of the expression that produced this value, e.g. {@code "$count"}. */
    String source();

    /** Base direction of the formatted value. */
    Direction dir();

    /** Locale tag the value formats for; may be empty. */
    String locale();

    /** Final merged formatting options. Empty for values without options. */
    default Map<String, Object> options() {
        return Map.of();
    }

    /** Formatted representation of the value. */
    @Override
    String toString();

    /** Formatted representation as typed parts. */
    List<MessagePart> toParts();

    /** The underlying raw value. */
    Object valueOf();

    /** Whether {@link #selectKeys(List)} can be used on this value. */
    default boolean selectable() {
        return false;
    }

    /**
     * Returns the subset of {@code keys} that match this value, best match first. An empty list
     * means nothing matched and the catchall variant applies.
     *
     * @throws MessageSelectionException with type {@code bad-selector} when the value does not
     *     support selection
     */
    default List<String> selectKeys(List<String> keys) {
        throw MessageSelectionException.notSelectable(type());
    }

    /**
     * {@link #toParts()} wrapped in the isolate pair for {@link #dir()}: LRI, RLI or FSI before the
     * value and PDI after it.
     */
    default List<MessagePart> toIsolatedParts() {
        Direction dir = dir() != null ? dir() : Direction.AUTO;
        char open = switch (dir) {
            case LTR -> DirectionResolver.LRI;
            case RTL -> DirectionResolver.RLI;
            case AUTO -> DirectionResolver.FSI;
        };
        List<MessagePart> parts = new ArrayList<>();
        parts.add(new BidiIsolationPart(String.valueOf(open)));
        parts.addAll(toParts());
        parts.add(new BidiIsolationPart(String.valueOf(DirectionResolver.PDI)));
        return parts;
    }
}
