package io.messageformat.core.part;

import java.util.Objects;

/** A typed slice of a rendered number. Concatenating the values of all sub-parts yields the number. */
public record NumberSubPart(Kind kind, String value) {

    /** Sub-part types, named after their {@code Intl.NumberFormat} counterparts. */
    public enum Kind {
        PLUS_SIGN("plusSign"),
        MINUS_SIGN("minusSign"),
        INTEGER("integer"),
        DECIMAL("decimal"),
        FRACTION("fraction"),
        CURRENCY("currency"),
        PERCENT_SIGN("percentSign"),
        UNIT("unit"),
        LITERAL("literal");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public NumberSubPart {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    /** The sub-part type string, e.g. {@code "integer"}. */
    public String type() {
        return kind.value();
    }
}
