package io.messageformat.core.spi;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.config.FormatConfig;
import io.messageformat.core.error.MessageFormatException;
import io.messageformat.core.locale.LocaleTags;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution context handed to a {@link MessageFunction} for one expression.
 *
 * @param locales           ordered locale preference list
 * @param source            source text of the expression, used for fallback rendering and
 *                          error attribution
 * @param localeMatcher     locale matching strategy, e.g. {@code "best fit"}
 * @param errorSink         receives resolution errors in evaluation order
 * @param literalOptionKeys names of the options whose values were written as literals
 * @param dir               direction override from the {@code u:dir} attribute, or {@code null}
 * @param id                expression id from the {@code u:id} attribute, or {@code null}
 */
public record FunctionContext(
        List<String> locales,
        String source,
        String localeMatcher,
        Consumer<? super MessageFormatException> errorSink,
        Set<String> literalOptionKeys,
        Direction dir,
        String id) {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionContext.class);

    /** Canonical constructor with defensive copies. */
    public FunctionContext {
        locales = locales != null ? List.copyOf(locales) : List.of();
        source = source != null ? source : "";
        localeMatcher = localeMatcher != null ? localeMatcher : FormatConfig.BEST_FIT;
        errorSink = errorSink != null ? errorSink : error -> {};
        literalOptionKeys = literalOptionKeys != null ? Set.copyOf(literalOptionKeys) : Set.of();
    }

    /** Reports an error: logged at DEBUG, then passed to the error sink. */
    public void onError(MessageFormatException error) {
        LOG.debug("{} in {}: {}", error.type().value(), source, error.getMessage());
        errorSink.accept(error);
    }

    /** The preferred locale, or {@code ""} when the list is empty. */
    public String firstLocale() {
        return LocaleTags.first(locales);
    }

    /** Whether {@code name} was given as a literal in the message source. */
    public boolean isLiteral(String name) {
        return literalOptionKeys.contains(name);
    }

    /** Returns a copy with a different source text. */
    public FunctionContext withSource(String newSource) {
        return new FunctionContext(locales, newSource, localeMatcher, errorSink, literalOptionKeys, dir, id);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with the locales and locale matcher of {@code config}. */
    public static Builder builder(FormatConfig config) {
        return new Builder().locales(config.locales()).localeMatcher(config.localeMatcher());
    }

    /** Builder for {@link FunctionContext}. */
    public static final class Builder {
        private List<String> locales = List.of(LocaleTags.DEFAULT_TAG);
        private String source = "";
        private String localeMatcher = FormatConfig.BEST_FIT;
        private Consumer<? super MessageFormatException> errorSink;
        private Set<String> literalOptionKeys = Set.of();
        private Direction dir;
        private String id;

        Builder() {}

        public Builder locales(List<String> locales) {
            this.locales = locales;
            return this;
        }

        public Builder locale(String locale) {
            this.locales = List.of(locale);
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder localeMatcher(String localeMatcher) {
            this.localeMatcher = localeMatcher;
            return this;
        }

        public Builder onError(Consumer<? super MessageFormatException> errorSink) {
            this.errorSink = errorSink;
            return this;
        }

        public Builder literalOptionKeys(Set<String> literalOptionKeys) {
            this.literalOptionKeys = literalOptionKeys;
            return this;
        }

        public Builder dir(Direction dir) {
            this.dir = dir;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public FunctionContext build() {
            return new FunctionContext(locales, source, localeMatcher, errorSink, literalOptionKeys, dir, id);
        }
    }
}
