package io.messageformat.core.number;

/**
 * CLDR plural categories. Variant keys use the lower-case {@link #value()}.
 *
 * <ul>
 *   <li>{@link #ZERO}, {@link #TWO}, {@link #FEW}, {@link #MANY}: used by languages with richer
 *       plural systems and by English ordinals ({@code two}, {@code few}).
 *   <li>{@link #ONE}: singular.
 *   <li>{@link #OTHER}: everything else; always present.
 * </ul>
 */
public enum PluralCategory {
    ZERO("zero"),
    ONE("one"),
    TWO("two"),
    FEW("few"),
    MANY("many"),
    OTHER("other");

    private final String value;

    PluralCategory(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
