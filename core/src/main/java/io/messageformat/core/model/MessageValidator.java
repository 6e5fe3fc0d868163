package io.messageformat.core.model;

import io.messageformat.core.error.ErrorType;
import io.messageformat.core.error.MessageDataModelException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the structural rules of a message that the syntax alone cannot enforce.
 *
 * <ul>
 *   <li>{@code duplicate-declaration}: a name declared twice.
 *   <li>{@code missing-selector-annotation}: a selector whose declaration has no function, directly
 *       or through the local variable it refers to.
 *   <li>{@code key-mismatch}: a variant with a key count different from the selector count.
 *   <li>{@code duplicate-variant}: two variants with the same keys.
 *   <li>{@code missing-fallback}: no variant with only catchall keys.
 * </ul>
 */
public final class MessageValidator {

    private static final Logger LOG = LoggerFactory.getLogger(MessageValidator.class);

    private MessageValidator() {
        // utility class
    }

    /**
     * Validates {@code message}, throwing on the first problem.
     *
     * @throws MessageDataModelException for the first rule violation found
     */
    public static ValidationResult validate(Message message) {
        return validate(message, error -> {
            throw error;
        });
    }

    /**
     * Validates {@code message}, reporting every problem to {@code onError} in source order.
     *
     * @return the functions and free variables of the message
     */
    public static ValidationResult validate(Message message, Consumer<? super MessageDataModelException> onError) {
        Set<String> functions = new LinkedHashSet<>();
        Set<String> variables = new LinkedHashSet<>();
        Set<String> declared = new HashSet<>();
        Set<String> annotated = new HashSet<>();
        Set<String> locals = new HashSet<>();

        for (Declaration declaration : message.declarations()) {
            String name = declaration.name();
            Expression value = declaration.value();
            boolean referencesAnnotated = value.arg() instanceof VariableRef ref && annotated.contains(ref.name());
            if (value.functionRef() != null
                    || (declaration instanceof Declaration.LocalDeclaration && referencesAnnotated)) {
                annotated.add(name);
            }
            if (declaration instanceof Declaration.LocalDeclaration) {
                locals.add(name);
            }
            if (!declared.add(name)) {
                report(onError, ErrorType.DUPLICATE_DECLARATION, "Duplicate declaration of $" + name, declaration);
            }
            collect(value, functions, variables);
        }

        if (message instanceof Message.PatternMessage patternMessage) {
            collect(patternMessage.pattern(), functions, variables);
        } else if (message instanceof Message.SelectMessage select) {
            validateSelect(select, annotated, functions, variables, onError);
        }

        variables.removeAll(locals);
        return new ValidationResult(functions, variables);
    }

    private static void validateSelect(
            Message.SelectMessage select,
            Set<String> annotated,
            Set<String> functions,
            Set<String> variables,
            Consumer<? super MessageDataModelException> onError) {
        for (VariableRef selector : select.selectors()) {
            variables.add(selector.name());
            if (!annotated.contains(selector.name())) {
                report(
                        onError,
                        ErrorType.MISSING_SELECTOR_ANNOTATION,
                        "Selector $" + selector.name() + " has no function annotation",
                        selector);
            }
        }

        int selectorCount = select.selectors().size();
        Set<List<String>> seen = new HashSet<>();
        boolean hasFallback = false;
        for (Variant variant : select.variants()) {
            if (variant.keys().size() != selectorCount) {
                report(
                        onError,
                        ErrorType.KEY_MISMATCH,
                        "Variant has " + variant.keys().size() + " keys, expected " + selectorCount,
                        variant);
            }
            if (variant.isFallback()) {
                hasFallback = true;
            }
            if (!seen.add(keyValues(variant))) {
                report(onError, ErrorType.DUPLICATE_VARIANT, "Duplicate variant " + variant.keys(), variant);
            }
            collect(variant.value(), functions, variables);
        }

        if (!hasFallback && selectorCount > 0) {
            VariableRef last = select.selectors().get(selectorCount - 1);
            report(onError, ErrorType.MISSING_FALLBACK, "No variant with only catchall keys", last);
        }
    }

    // null stands for the catchall
    private static List<String> keyValues(Variant variant) {
        List<String> values = new ArrayList<>();
        for (VariantKey key : variant.keys()) {
            values.add(key instanceof Literal literal ? literal.value() : null);
        }
        return values;
    }

    private static void collect(Pattern pattern, Set<String> functions, Set<String> variables) {
        for (PatternElement element : pattern.elements()) {
            if (element instanceof Expression expression) {
                collect(expression, functions, variables);
            } else if (element instanceof Markup markup) {
                collectOptions(markup.options().values(), variables);
            }
        }
    }

    private static void collect(Expression expression, Set<String> functions, Set<String> variables) {
        if (expression.functionRef() != null) {
            functions.add(expression.functionRef().name());
            collectOptions(expression.functionRef().options().values(), variables);
        }
        if (expression.arg() instanceof VariableRef ref) {
            variables.add(ref.name());
        }
    }

    private static void collectOptions(Iterable<Argument> options, Set<String> variables) {
        for (Argument option : options) {
            if (option instanceof VariableRef ref) {
                variables.add(ref.name());
            }
        }
    }

    private static void report(
            Consumer<? super MessageDataModelException> onError, ErrorType type, String message, Object node) {
        LOG.debug("{}: {}", type, message);
        onError.accept(new MessageDataModelException(type, message, node));
    }
}
