package io.messageformat.core.model;

import io.messageformat.core.part.MarkupPart;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** {@code {#name}}, {@code {/name}} or {@code {#name /}}. */
public record Markup(Kind kind, String name, Map<String, Argument> options, Map<String, Object> attributes)
        implements PatternElement {

    /** Markup kind, from the opening sigil and the trailing slash. */
    public enum Kind {
        OPEN("open"),
        CLOSE("close"),
        STANDALONE("standalone");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public Markup {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    /**
     * Converts to a part. Literal options keep their value, resolved ones their raw value; variable
     * options are left out since resolving them is up to the caller.
     */
    public MarkupPart toPart(String source) {
        Map<String, Object> partOptions = new LinkedHashMap<>();
        options.forEach((key, value) -> {
            if (value instanceof Literal literal) {
                partOptions.put(key, literal.value());
            } else if (value instanceof ResolvedArgument resolved) {
                partOptions.put(key, resolved.value().valueOf());
            }
        });
        return new MarkupPart(kind.value(), name, source, partOptions);
    }
}
