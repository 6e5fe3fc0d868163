package io.messageformat.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link Message} back to MessageFormat 2 source. Parsing the output yields an
 * equivalent message; formatting details such as whitespace and literal quoting are normalized.
 */
public final class MessageStringifier {

    private static final java.util.regex.Pattern LEADING_DOT =
            java.util.regex.Pattern.compile("^\\s*\\.");

    private static final String LITERAL_SPECIALS = " \t\n\r{}|\\=@$:#/";

    private MessageStringifier() {
        // utility class
    }

    public static String stringify(Message message) {
        StringBuilder out = new StringBuilder();
        for (Declaration declaration : message.declarations()) {
            if (declaration instanceof Declaration.InputDeclaration) {
                out.append(".input ").append(expression(declaration.value())).append('\n');
            } else {
                out.append(".local $")
                        .append(declaration.name())
                        .append(" = ")
                        .append(expression(declaration.value()))
                        .append('\n');
            }
        }

        if (message instanceof Message.PatternMessage patternMessage) {
            out.append(pattern(patternMessage.pattern(), !message.declarations().isEmpty()));
            return out.toString();
        }

        Message.SelectMessage select = (Message.SelectMessage) message;
        out.append(".match");
        for (VariableRef selector : select.selectors()) {
            out.append(" $").append(selector.name());
        }
        for (Variant variant : select.variants()) {
            out.append('\n');
            for (VariantKey key : variant.keys()) {
                out.append(key instanceof Literal literal ? literal(literal.value()) : "*").append(' ');
            }
            out.append(pattern(variant.value(), true));
        }
        return out.toString();
    }

    static String pattern(Pattern pattern, boolean quoted) {
        if (!quoted && !pattern.isEmpty() && pattern.elements().get(0) instanceof TextElement first) {
            quoted = LEADING_DOT.matcher(first.value()).find();
        }
        StringBuilder out = new StringBuilder();
        for (PatternElement element : pattern.elements()) {
            if (element instanceof TextElement text) {
                out.append(text.value()
                        .replace("\\", "\\\\")
                        .replace("{", "\\{")
                        .replace("}", "\\}"));
            } else if (element instanceof Expression expression) {
                out.append(expression(expression));
            } else if (element instanceof Markup markup) {
                out.append(markup(markup));
            }
        }
        return quoted ? "{{" + out + "}}" : out.toString();
    }

    static String expression(Expression expression) {
        List<String> parts = new ArrayList<>();
        if (expression.arg() != null) {
            parts.add(argument(expression.arg()));
        }
        FunctionRef functionRef = expression.functionRef();
        if (functionRef != null) {
            StringBuilder function = new StringBuilder(":").append(functionRef.name());
            options(function, functionRef.options());
            parts.add(function.toString());
        }
        expression.attributes().forEach((name, value) -> parts.add(attribute(name, value)));
        return "{" + String.join(" ", parts) + "}";
    }

    static String markup(Markup markup) {
        StringBuilder out = new StringBuilder(markup.kind() == Markup.Kind.CLOSE ? "{/" : "{#");
        out.append(markup.name());
        options(out, markup.options());
        markup.attributes().forEach((name, value) -> out.append(' ').append(attribute(name, value)));
        out.append(markup.kind() == Markup.Kind.STANDALONE ? " /}" : "}");
        return out.toString();
    }

    /** A literal as written in source: bare when possible, otherwise {@code |quoted|}. */
    static String literal(String value) {
        if (isUnquotedLiteral(value)) {
            return value;
        }
        return "|" + value.replace("\\", "\\\\").replace("|", "\\|") + "|";
    }

    private static void options(StringBuilder out, Map<String, Argument> options) {
        options.forEach((name, value) -> out.append(' ').append(name).append('=').append(argument(value)));
    }

    private static String argument(Argument argument) {
        if (argument instanceof Literal literal) {
            return literal(literal.value());
        }
        if (argument instanceof VariableRef ref) {
            return "$" + ref.name();
        }
        if (!(argument instanceof ResolvedArgument resolved)) {
            throw new IllegalArgumentException("Unsupported argument: " + argument);
        }
        String source = resolved.value().source();
        return source != null && !source.isEmpty() ? source : literal(resolved.value().toString());
    }

    private static String attribute(String name, Object value) {
        if (Boolean.TRUE.equals(value)) {
            return "@" + name;
        }
        if (value instanceof Literal literal) {
            return "@" + name + "=" + literal(literal.value());
        }
        return "@" + name + "=" + value;
    }

    private static boolean isUnquotedLiteral(String value) {
        if (value.isEmpty() || value.startsWith(".")) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (LITERAL_SPECIALS.indexOf(value.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }
}
