package io.messageformat.core.error;

/**
 * Thrown when a message is syntactically valid but structurally wrong: an {@code .input}
 * declaration without a variable, duplicate declarations, variant key mismatches and the like.
 * Carries the offending data model node when one is known.
 */
public final class MessageDataModelException extends MessageFormatException {

    private static final long serialVersionUID = 1L;

    private final transient Object node;

    public MessageDataModelException(ErrorType type, String message, Object node) {
        super(type, message, Phase.DATA_MODEL);
        this.node = node;
    }

    /** The data model or syntax tree node that triggered the error, or {@code null}. */
    public Object node() {
        return node;
    }
}
