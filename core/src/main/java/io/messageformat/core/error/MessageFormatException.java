package io.messageformat.core.error;

/**
 * Abstract base for all MessageFormat errors. Never thrown directly; use one of the concrete
 * subclasses, one per {@link Phase}.
 *
 * <p>Resolution errors are normally not thrown at all: functions hand them to the error sink of
 * their {@code FunctionContext} and return a usable value.
 */
public abstract class MessageFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        DATA_MODEL,
        RESOLUTION,
        SELECTION
    }

    private final ErrorType type;
    private final Phase phase;

    protected MessageFormatException(ErrorType type, String message, Phase phase) {
        super(message);
        this.type = type;
        this.phase = phase;
    }

    protected MessageFormatException(ErrorType type, String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.type = type;
        this.phase = phase;
    }

    /** The error type code. */
    public ErrorType type() {
        return type;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
