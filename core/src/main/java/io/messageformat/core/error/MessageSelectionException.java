package io.messageformat.core.error;

/** Thrown when a resolved value cannot take part in variant selection. */
public final class MessageSelectionException extends MessageFormatException {

    private static final long serialVersionUID = 1L;

    public MessageSelectionException(ErrorType type, String message) {
        super(type, message, Phase.SELECTION);
    }

    public MessageSelectionException(ErrorType type, String message, Throwable cause) {
        super(type, message, cause, Phase.SELECTION);
    }

    /** Selection attempted on a value that does not support it. */
    public static MessageSelectionException notSelectable(String valueType) {
        return new MessageSelectionException(
                ErrorType.BAD_SELECTOR, "Value of type '" + valueType + "' does not support selection");
    }
}
