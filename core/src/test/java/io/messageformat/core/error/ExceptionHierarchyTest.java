package io.messageformat.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Structure of the exception hierarchy and the stable error type strings. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void messageFormatExceptionIsAbstractAndUnchecked() {
        assertThat(MessageFormatException.class).isAbstract();
        assertThat(MessageFormatException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void concreteExceptionsAreFinal() {
        assertThat(MessageSyntaxException.class).isFinal();
        assertThat(MessageDataModelException.class).isFinal();
        assertThat(MessageResolutionException.class).isFinal();
        assertThat(MessageSelectionException.class).isFinal();
    }

    // --- Phases and fields ---

    @Test
    void syntaxExceptionCarriesOffsets() {
        var ex = new MessageSyntaxException(ErrorType.PARSE_ERROR, 3, 7, "}");

        assertThat(ex.phase()).isEqualTo(MessageFormatException.Phase.PARSE);
        assertThat(ex.type()).isEqualTo(ErrorType.PARSE_ERROR);
        assertThat(ex.start()).isEqualTo(3);
        assertThat(ex.end()).isEqualTo(7);
        assertThat(ex.expected()).isEqualTo("}");
        assertThat(ex.getMessage()).contains("parse-error").contains("3-7").contains("expected }");
    }

    @Test
    void syntaxExceptionWithEmptyRangeShowsSingleOffset() {
        var ex = new MessageSyntaxException(ErrorType.SYNTAX_ERROR, 5, 5);

        assertThat(ex.getMessage()).isEqualTo("Syntax error: syntax-error at 5");
        assertThat(ex.expected()).isNull();
    }

    @Test
    void dataModelExceptionCarriesNode() {
        Object node = new Object();
        var ex = new MessageDataModelException(ErrorType.DUPLICATE_DECLARATION, "duplicate $x", node);

        assertThat(ex.phase()).isEqualTo(MessageFormatException.Phase.DATA_MODEL);
        assertThat(ex.node()).isSameAs(node);
        assertThat(ex.detail()).isEqualTo("duplicate $x");
    }

    @Test
    void resolutionFactoriesSetTypeAndSource() {
        assertThat(MessageResolutionException.badOperand("x", "$a").type()).isEqualTo(ErrorType.BAD_OPERAND);
        assertThat(MessageResolutionException.badOption("x", "$a").type()).isEqualTo(ErrorType.BAD_OPTION);
        assertThat(MessageResolutionException.unsupportedOperation("x", "$a").type())
                .isEqualTo(ErrorType.UNSUPPORTED_OPERATION);

        var unknown = MessageResolutionException.unknownFunction("foo", ":foo");
        assertThat(unknown.type()).isEqualTo(ErrorType.UNKNOWN_FUNCTION);
        assertThat(unknown.source()).isEqualTo(":foo");
        assertThat(unknown.getMessage()).isEqualTo("Unknown function :foo");
        assertThat(unknown.phase()).isEqualTo(MessageFormatException.Phase.RESOLUTION);
    }

    @Test
    void resolutionExceptionKeepsCause() {
        var cause = new IllegalStateException("boom");
        var ex = new MessageResolutionException(ErrorType.BAD_OPERAND, "Input is not numeric", cause, "|x|");

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void notSelectableIsBadSelector() {
        var ex = MessageSelectionException.notSelectable("currency");

        assertThat(ex.type()).isEqualTo(ErrorType.BAD_SELECTOR);
        assertThat(ex.phase()).isEqualTo(MessageFormatException.Phase.SELECTION);
        assertThat(ex.getMessage()).contains("currency");
    }

    // --- Type strings ---

    @ParameterizedTest
    @EnumSource(ErrorType.class)
    void typeStringsRoundTrip(ErrorType type) {
        assertThat(ErrorType.fromValue(type.value())).contains(type);
        assertThat(type.toString()).isEqualTo(type.value());
    }

    @Test
    void publicTaxonomyIsPresent() {
        assertThat(Arrays.stream(ErrorType.values()).map(ErrorType::value))
                .contains(
                        "syntax-error",
                        "data-model-error",
                        "bad-operand",
                        "bad-option",
                        "bad-selector",
                        "unresolved-variable",
                        "unsupported-operation",
                        "bad-function-result");
    }

    @Test
    void unknownTypeStringIsEmpty() {
        assertThat(ErrorType.fromValue("no-such-error")).isEmpty();
    }
}
