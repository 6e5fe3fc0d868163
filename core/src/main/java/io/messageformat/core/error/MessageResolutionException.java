package io.messageformat.core.error;

/**
 * Reported when an expression cannot be resolved as written: a non-numeric operand, an invalid
 * option value, an unknown function or an unsupported operation. Carries the source text of the
 * expression.
 */
public final class MessageResolutionException extends MessageFormatException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public MessageResolutionException(ErrorType type, String message, String source) {
        super(type, message, Phase.RESOLUTION);
        this.source = source;
    }

    public MessageResolutionException(ErrorType type, String message, Throwable cause, String source) {
        super(type, message, cause, Phase.RESOLUTION);
        this.source = source;
    }

    /** Source text of the expression that failed, e.g. {@code "$count"}. */
    public String source() {
        return source;
    }

    public static MessageResolutionException badOperand(String message, String source) {
        return new MessageResolutionException(ErrorType.BAD_OPERAND, message, source);
    }

    public static MessageResolutionException badOption(String message, String source) {
        return new MessageResolutionException(ErrorType.BAD_OPTION, message, source);
    }

    public static MessageResolutionException unsupportedOperation(String message, String source) {
        return new MessageResolutionException(ErrorType.UNSUPPORTED_OPERATION, message, source);
    }

    public static MessageResolutionException unknownFunction(String name, String source) {
        return new MessageResolutionException(ErrorType.UNKNOWN_FUNCTION, "Unknown function :" + name, source);
    }
}
