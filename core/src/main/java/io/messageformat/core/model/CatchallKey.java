package io.messageformat.core.model;

/** The {@code *} key, matching any selector value. */
public record CatchallKey() implements VariantKey {

    public static final CatchallKey INSTANCE = new CatchallKey();

    @Override
    public String toString() {
        return "*";
    }
}
