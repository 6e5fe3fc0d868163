package io.messageformat.core.bidi;

/**
 * Base direction of a piece of formatted text.
 *
 * <ul>
 *   <li>{@link #LTR}: left-to-right (Latin, Cyrillic, most scripts).
 *   <li>{@link #RTL}: right-to-left (Hebrew, Arabic and related scripts).
 *   <li>{@link #AUTO}: direction is not known up front and is determined from the content.
 * </ul>
 */
public enum Direction {
    LTR("ltr"),
    RTL("rtl"),
    AUTO("auto");

    private final String value;

    Direction(String value) {
        this.value = value;
    }

    /** Returns the lower-case wire value ({@code "ltr"}, {@code "rtl"} or {@code "auto"}). */
    public String value() {
        return value;
    }

    /**
     * Resolves a wire value to a {@link Direction}. Unrecognized and {@code null} values resolve to
     * {@link #AUTO}.
     */
    public static Direction fromValue(String value) {
        if (value != null) {
            for (Direction direction : values()) {
                if (direction.value.equals(value)) {
                    return direction;
                }
            }
        }
        return AUTO;
    }
}
