package io.messageformat.core.function;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Validation of option names. */
public final class OptionKeys {

    public static final int MAX_KEY_LENGTH = 100;
    public static final int MAX_OPTIONS = 50;

    private static final Set<String> FORBIDDEN = Set.of(
            "__proto__",
            "constructor",
            "prototype",
            "__definegetter__",
            "__definesetter__",
            "__lookupgetter__",
            "__lookupsetter__");

    private OptionKeys() {
        // utility class
    }

    /**
     * Checks one option name: non-empty, at most {@value #MAX_KEY_LENGTH} characters of {@code
     * [A-Za-z0-9_-]}, and not a reserved object-model name (compared case-insensitively).
     *
     * @throws IllegalArgumentException if the name is not acceptable
     */
    public static void validate(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Option key must not be empty");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Option key too long: " + key.length() + " characters (max: " + MAX_KEY_LENGTH + ")");
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (!isKeyChar(c)) {
                throw new IllegalArgumentException(
                        "Invalid character '" + c + "' at position " + i + " in option key '" + key + "'");
            }
        }
        if (FORBIDDEN.contains(key.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Forbidden option key: '" + key + "'");
        }
    }

    /**
     * Checks an option map: at most {@value #MAX_OPTIONS} entries, each with a valid name.
     *
     * @throws IllegalArgumentException naming the first problem found
     */
    public static void validateAll(Map<String, ?> options) {
        if (options == null) {
            return;
        }
        if (options.size() > MAX_OPTIONS) {
            throw new IllegalArgumentException(
                    "Too many options: " + options.size() + " (max: " + MAX_OPTIONS + ")");
        }
        for (String key : options.keySet()) {
            try {
                validate(key);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid option: " + e.getMessage(), e);
            }
        }
    }

    /** Returns a copy of {@code options} without the entries whose names fail {@link #validate}. */
    public static Map<String, Object> sanitize(Map<String, ?> options) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (options == null) {
            return sanitized;
        }
        options.forEach((key, value) -> {
            if (isValid(key)) {
                sanitized.put(key, value);
            }
        });
        return sanitized;
    }

    /** Non-throwing variant of {@link #validate(String)}. */
    public static boolean isValid(String key) {
        try {
            validate(key);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isKeyChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }
}
