package io.messageformat.core.locale;

import java.util.List;
import java.util.Locale;

/** Helpers for BCP 47 locale tags as they arrive from callers (strings, possibly with underscores). */
public final class LocaleTags {

    /** Locale used when a caller supplies none. */
    public static final String DEFAULT_TAG = "en-US";

    private LocaleTags() {
        // utility class
    }

    /**
     * Converts a tag to a {@link Locale}. Underscores are accepted as separators; {@code null},
     * empty and unparseable tags map to {@value #DEFAULT_TAG}.
     */
    public static Locale toLocale(String tag) {
        if (tag == null || tag.isBlank()) {
            return Locale.forLanguageTag(DEFAULT_TAG);
        }
        Locale locale = Locale.forLanguageTag(tag.strip().replace('_', '-'));
        return locale.getLanguage().isEmpty() ? Locale.forLanguageTag(DEFAULT_TAG) : locale;
    }

    /** First entry of a locale preference list, or {@code ""} when the list is empty. */
    public static String first(List<String> locales) {
        if (locales == null || locales.isEmpty() || locales.get(0) == null) {
            return "";
        }
        return locales.get(0);
    }

    /** Primary language subtag, lower case ({@code "en-US"} → {@code "en"}). */
    public static String language(String tag) {
        return toLocale(tag).getLanguage();
    }
}
