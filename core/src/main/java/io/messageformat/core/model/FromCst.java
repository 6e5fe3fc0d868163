package io.messageformat.core.model;

import io.messageformat.core.cst.Cst;
import io.messageformat.core.error.ErrorType;
import io.messageformat.core.error.MessageDataModelException;
import io.messageformat.core.error.MessageSyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a concrete syntax tree into a {@link Message}.
 *
 * <p>Conversion is all-or-nothing: a tree that carries parse errors, junk or a node of an
 * unexpected shape raises a {@link MessageSyntaxException}, and an {@code .input} declaration whose
 * argument is not a variable raises a {@link MessageDataModelException}. No partial message is
 * ever returned.
 */
public final class FromCst {

    private FromCst() {
        // utility class
    }

    /**
     * Builds the data model for {@code message}.
     *
     * @throws MessageSyntaxException for the first parse error of the tree, or for junk
     * @throws MessageDataModelException for an {@code .input} declaration without a variable
     */
    public static Message fromCst(Cst.Message message) {
        if (!message.errors().isEmpty()) {
            Cst.ParseError first = message.errors().get(0);
            ErrorType type = ErrorType.fromValue(first.type()).orElse(ErrorType.PARSE_ERROR);
            throw new MessageSyntaxException(type, first.start(), first.end(), first.expected());
        }

        List<Declaration> declarations = new ArrayList<>();
        for (Cst.Declaration declaration : message.declarations()) {
            declarations.add(asDeclaration(declaration));
        }

        if (message instanceof Cst.SelectMessage select) {
            List<VariableRef> selectors = new ArrayList<>();
            for (Cst.VariableRef selector : select.selectors()) {
                selectors.add(new VariableRef(selector.name()));
            }
            List<Variant> variants = new ArrayList<>();
            for (Cst.Variant variant : select.variants()) {
                variants.add(asVariant(variant));
            }
            return new Message.SelectMessage(declarations, selectors, variants);
        }
        Cst.Pattern pattern = message instanceof Cst.SimpleMessage simple
                ? simple.pattern()
                : ((Cst.ComplexMessage) message).pattern();
        return new Message.PatternMessage(declarations, asPattern(pattern));
    }

    private static Declaration asDeclaration(Cst.Declaration declaration) {
        if (declaration instanceof Cst.InputDeclaration input) {
            Expression expression = asExpression(input.value(), input);
            if (!(expression.arg() instanceof VariableRef ref)) {
                throw new MessageDataModelException(
                        ErrorType.DATA_MODEL_ERROR,
                        "The argument of an .input declaration must be a variable reference",
                        declaration);
            }
            return new Declaration.InputDeclaration(ref.name(), expression);
        }
        Cst.LocalDeclaration local = (Cst.LocalDeclaration) declaration;
        if (!(local.target() instanceof Cst.VariableRef target)) {
            throw syntaxError(local.target() != null ? local.target() : local);
        }
        return new Declaration.LocalDeclaration(target.name(), asExpression(local.value(), local));
    }

    private static Variant asVariant(Cst.Variant variant) {
        List<VariantKey> keys = new ArrayList<>();
        for (Cst.Node key : variant.keys()) {
            if (key instanceof Cst.CatchallKey) {
                keys.add(CatchallKey.INSTANCE);
            } else if (key instanceof Cst.Literal literal) {
                keys.add(new Literal(literal.value()));
            } else {
                throw syntaxError(key);
            }
        }
        return new Variant(keys, asPattern(variant.value()));
    }

    private static Pattern asPattern(Cst.Pattern pattern) {
        List<PatternElement> elements = new ArrayList<>();
        for (Cst.Node node : pattern.body()) {
            if (node instanceof Cst.Text text) {
                elements.add(new TextElement(text.value()));
            } else if (node instanceof Cst.Expression expression && expression.markup() != null) {
                elements.add(asMarkup(expression));
            } else {
                elements.add(asExpression(node, node));
            }
        }
        return new Pattern(elements);
    }

    private static Expression asExpression(Cst.Node node, Cst.Node owner) {
        if (!(node instanceof Cst.Expression expression)) {
            throw syntaxError(node != null ? node : owner);
        }
        Argument arg = expression.arg() != null ? asArgument(expression.arg()) : null;
        FunctionRef functionRef = null;
        if (expression.functionRef() != null) {
            if (!(expression.functionRef() instanceof Cst.FunctionRef ref)) {
                throw syntaxError(expression);
            }
            functionRef = new FunctionRef(asName(ref.name()), asOptions(ref.options()));
        }
        return new Expression(arg, functionRef, asAttributes(expression.attributes()));
    }

    private static Markup asMarkup(Cst.Expression expression) {
        Cst.Markup markup = expression.markup();
        Markup.Kind kind;
        if ("/".equals(markup.open().value())) {
            kind = Markup.Kind.CLOSE;
        } else if (markup.close() != null) {
            kind = Markup.Kind.STANDALONE;
        } else {
            kind = Markup.Kind.OPEN;
        }
        return new Markup(
                kind, asName(markup.name()), asOptions(markup.options()), asAttributes(expression.attributes()));
    }

    private static Map<String, Argument> asOptions(List<Cst.Option> options) {
        Map<String, Argument> result = new LinkedHashMap<>();
        for (Cst.Option option : options) {
            result.put(asName(option.name()), asArgument(option.value()));
        }
        return result;
    }

    private static Map<String, Object> asAttributes(List<Cst.Attribute> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Cst.Attribute attribute : attributes) {
            Object value = attribute.value() != null ? new Literal(attribute.value().value()) : Boolean.TRUE;
            result.put(asName(attribute.name()), value);
        }
        return result;
    }

    private static Argument asArgument(Cst.Node node) {
        if (node instanceof Cst.Literal literal) {
            return new Literal(literal.value());
        }
        if (node instanceof Cst.VariableRef ref) {
            return new VariableRef(ref.name());
        }
        throw syntaxError(node);
    }

    /**
     * {@code [name]} gives {@code name}, {@code [ns, :, name]} gives {@code ns:name}; any other
     * token count gives an empty name.
     */
    static String asName(List<Cst.Syntax> identifier) {
        if (identifier.size() == 1) {
            return identifier.get(0).value();
        }
        if (identifier.size() == 3) {
            return identifier.get(0).value() + ":" + identifier.get(2).value();
        }
        return "";
    }

    private static MessageSyntaxException syntaxError(Cst.Node node) {
        return new MessageSyntaxException(ErrorType.PARSE_ERROR, node.start(), node.end());
    }
}
