package io.messageformat.core.error;

/**
 * Thrown when a syntax tree carries an error node or junk. Offsets are byte positions in the
 * message source; {@code end} is exclusive.
 */
public final class MessageSyntaxException extends MessageFormatException {

    private static final long serialVersionUID = 1L;

    private final int start;
    private final int end;
    private final String expected;

    public MessageSyntaxException(ErrorType type, int start, int end) {
        this(type, start, end, null);
    }

    public MessageSyntaxException(ErrorType type, int start, int end, String expected) {
        super(type, describe(type, start, end, expected), Phase.PARSE);
        this.start = start;
        this.end = end;
        this.expected = expected;
    }

    /** Start offset of the offending source range. */
    public int start() {
        return start;
    }

    /** End offset (exclusive) of the offending source range. */
    public int end() {
        return end;
    }

    /** The token the parser expected, or {@code null}. */
    public String expected() {
        return expected;
    }

    private static String describe(ErrorType type, int start, int end, String expected) {
        String message = "Syntax error: " + type.value() + " at " + start;
        if (end != start) {
            message += "-" + end;
        }
        if (expected != null) {
            message += ", expected " + expected;
        }
        return message;
    }
}
