package io.messageformat.core.model;

import io.messageformat.core.part.MessagePart;
import java.util.ArrayList;
import java.util.List;

/** Elements in output order. */
public record Pattern(List<PatternElement> elements) {

    public static final Pattern EMPTY = new Pattern(List.of());

    public Pattern {
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Parts for the text and markup elements; expressions are skipped since they need resolving
     * first.
     */
    public List<MessagePart> staticParts() {
        List<MessagePart> parts = new ArrayList<>();
        for (PatternElement element : elements) {
            if (element instanceof TextElement text) {
                parts.add(text.toPart());
            } else if (element instanceof Markup markup) {
                parts.add(markup.toPart(""));
            }
        }
        return parts;
    }
}
