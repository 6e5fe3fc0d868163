package io.messageformat.core.config;

import io.messageformat.core.locale.LocaleTags;
import java.util.List;

/**
 * Engine defaults: the locale preference list, the locale matching strategy and whether the draft
 * functions are registered.
 *
 * <p>Use {@link #builder()} to construct instances; unset fields take the defaults of {@link
 * #DEFAULT}.
 *
 * @param locales        ordered locale preference list, never empty
 * @param localeMatcher  {@code "best fit"} or {@code "lookup"}
 * @param draftFunctions register {@code :currency}, {@code :date}, {@code :datetime}, {@code
 *                       :math}, {@code :percent}, {@code :time} and {@code :unit}
 */
public record FormatConfig(List<String> locales, String localeMatcher, boolean draftFunctions) {

    public static final String BEST_FIT = "best fit";

    /** {@code [en-US]}, best fit, stable functions only. */
    public static final FormatConfig DEFAULT = builder().build();

    /** Canonical constructor with defensive copies. */
    public FormatConfig {
        locales = locales == null || locales.isEmpty() ? List.of(LocaleTags.DEFAULT_TAG) : List.copyOf(locales);
        localeMatcher = localeMatcher == null || localeMatcher.isBlank() ? BEST_FIT : localeMatcher;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link FormatConfig}. */
    public static final class Builder {
        private List<String> locales = List.of(LocaleTags.DEFAULT_TAG);
        private String localeMatcher = BEST_FIT;
        private boolean draftFunctions;

        Builder() {}

        public Builder locales(List<String> locales) {
            this.locales = locales;
            return this;
        }

        public Builder localeMatcher(String localeMatcher) {
            this.localeMatcher = localeMatcher;
            return this;
        }

        public Builder draftFunctions(boolean draftFunctions) {
            this.draftFunctions = draftFunctions;
            return this;
        }

        public FormatConfig build() {
            return new FormatConfig(locales, localeMatcher, draftFunctions);
        }
    }
}
