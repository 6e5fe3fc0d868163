package io.messageformat.core.part;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Markup placeholder. {@code kind} is {@code "open"}, {@code "close"} or {@code "standalone"};
 * the value of the part is the markup name.
 */
public record MarkupPart(String kind, String name, String source, Map<String, Object> options)
        implements MessagePart {

    /** Canonical constructor with defensive copies. */
    public MarkupPart {
        source = source != null ? source : "";
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }

    @Override
    public String type() {
        return "markup";
    }

    @Override
    public Object value() {
        return name;
    }
}
