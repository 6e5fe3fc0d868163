package io.messageformat.core.error;

import java.util.Optional;

/**
 * Stable error type codes surfaced to error sinks and carried by every {@link
 * MessageFormatException}.
 *
 * <p>The first eight codes form the public taxonomy; the rest are finer-grained codes produced by
 * the data model builder, the validator and the registry.
 */
public enum ErrorType {
    SYNTAX_ERROR("syntax-error"),
    DATA_MODEL_ERROR("data-model-error"),
    BAD_OPERAND("bad-operand"),
    BAD_OPTION("bad-option"),
    BAD_SELECTOR("bad-selector"),
    UNRESOLVED_VARIABLE("unresolved-variable"),
    UNSUPPORTED_OPERATION("unsupported-operation"),
    BAD_FUNCTION_RESULT("bad-function-result"),

    // --- Parse and data model detail ---
    PARSE_ERROR("parse-error"),
    KEY_MISMATCH("key-mismatch"),
    MISSING_FALLBACK("missing-fallback"),
    MISSING_SELECTOR_ANNOTATION("missing-selector-annotation"),
    DUPLICATE_DECLARATION("duplicate-declaration"),
    DUPLICATE_VARIANT("duplicate-variant"),

    // --- Resolution and selection detail ---
    UNKNOWN_FUNCTION("unknown-function"),
    NOT_FORMATTABLE("not-formattable"),
    NO_MATCH("no-match");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    /** Returns the kebab-case type string, e.g. {@code "bad-option"}. */
    public String value() {
        return value;
    }

    /** Looks up an error type by its type string. */
    public static Optional<ErrorType> fromValue(String value) {
        for (ErrorType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
