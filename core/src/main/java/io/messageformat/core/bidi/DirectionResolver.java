package io.messageformat.core.bidi;

import java.util.Locale;
import java.util.Set;

/**
 * Classifies text and locales by writing direction and wraps formatted values in Unicode bidi
 * isolates.
 *
 * <p>Classification is block based: the first strongly directional code point decides. Digits,
 * punctuation and whitespace are neutral.
 */
public final class DirectionResolver {

    /** Left-to-right isolate. */
    public static final char LRI = '\u2066';

    /** Right-to-left isolate. */
    public static final char RLI = '\u2067';

    /** First strong isolate. */
    public static final char FSI = '\u2068';

    /** Pop directional isolate. */
    public static final char PDI = '\u2069';

    private static final Set<String> RTL_LANGUAGES = Set.of("ar", "he", "fa", "ur", "yi");

    /** Inclusive code point ranges of right-to-left blocks. */
    private static final int[][] RTL_RANGES = {
        {0x0590, 0x05FF}, // Hebrew
        {0x0600, 0x06FF}, // Arabic
        {0x0700, 0x074F}, // Syriac
        {0x0750, 0x077F}, // Arabic Supplement
        {0x0780, 0x07BF}, // Thaana
        {0x07C0, 0x07FF}, // NKo
        {0x0800, 0x083F}, // Samaritan
        {0x08A0, 0x08FF}, // Arabic Extended-A
        {0xFB1D, 0xFB4F}, // Hebrew presentation forms
        {0xFB50, 0xFDFF}, // Arabic Presentation Forms-A
        {0xFE70, 0xFEFF} // Arabic Presentation Forms-B
    };

    private DirectionResolver() {
        // utility class
    }

    /**
     * Returns the direction of the first strongly directional code point in {@code text}, or
     * {@link Direction#AUTO} when there is none (empty input, digits, punctuation).
     */
    public static Direction getDirection(String text) {
        if (text == null || text.isEmpty()) {
            return Direction.AUTO;
        }
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (isRtl(cp)) {
                return Direction.RTL;
            }
            if (isLtr(cp)) {
                return Direction.LTR;
            }
            i += Character.charCount(cp);
        }
        return Direction.AUTO;
    }

    /**
     * Returns the direction of a locale tag based on its primary language subtag (the part before
     * the first {@code -}). Defaults to {@link Direction#LTR}, including for empty input.
     */
    public static Direction getLocaleDirection(String locale) {
        if (locale == null || locale.isEmpty()) {
            return Direction.LTR;
        }
        int dash = locale.indexOf('-');
        String language = (dash >= 0 ? locale.substring(0, dash) : locale).toLowerCase(Locale.ROOT);
        return RTL_LANGUAGES.contains(language) ? Direction.RTL : Direction.LTR;
    }

    /**
     * Wraps {@code text} in the isolate pair matching {@code dir} ({@code "ltr"} → LRI…PDI,
     * {@code "rtl"} → RLI…PDI, {@code "auto"} → FSI…PDI). Any other value returns the text
     * unchanged.
     */
    public static String wrapWithIsolation(String text, String dir) {
        if (dir == null) {
            return text;
        }
        return switch (dir) {
            case "ltr" -> LRI + text + PDI;
            case "rtl" -> RLI + text + PDI;
            case "auto" -> FSI + text + PDI;
            default -> text;
        };
    }

    /** Typed overload of {@link #wrapWithIsolation(String, String)}. */
    public static String wrapWithIsolation(String text, Direction dir) {
        return dir == null ? text : wrapWithIsolation(text, dir.value());
    }

    /** Returns {@code true} for the four isolate control characters LRI, RLI, FSI and PDI. */
    public static boolean isIsolationChar(int codePoint) {
        return codePoint == LRI || codePoint == RLI || codePoint == FSI || codePoint == PDI;
    }

    static boolean isRtl(int cp) {
        for (int[] range : RTL_RANGES) {
            if (cp >= range[0] && cp <= range[1]) {
                return true;
            }
        }
        return false;
    }

    static boolean isLtr(int cp) {
        if ((cp >= 0x0041 && cp <= 0x005A) || (cp >= 0x0061 && cp <= 0x007A)) {
            return true; // Basic Latin letters
        }
        if (cp >= 0x00C0 && cp <= 0x024F) {
            return true; // Latin-1 Supplement and Latin Extended
        }
        if (cp >= 0x0400 && cp <= 0x04FF) {
            return true; // Cyrillic
        }
        return Character.isLetter(cp) && !isRtl(cp);
    }
}
