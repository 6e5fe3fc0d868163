package io.messageformat.core.cst;

import java.util.List;

/**
 * Concrete syntax tree of a message, as produced by a parser. Nodes keep their source offsets
 * ({@code end} exclusive) so that errors can point back into the source.
 *
 * <p>The tree may be incomplete: a parser records what it could not parse as {@link Junk} nodes
 * and {@link ParseError}s on the message, and keeps going.
 */
public final class Cst {

    private Cst() {
        // namespace for the node types
    }

    /** A problem the parser found. */
    public record ParseError(String type, int start, int end, String expected) {}

    /** A whole message. */
    public sealed interface Message {
        List<ParseError> errors();

        List<Declaration> declarations();
    }

    /** Any node with a source range. */
    public sealed interface Node {
        int start();

        int end();
    }

    /** A message consisting of a pattern only. */
    public record SimpleMessage(Pattern pattern, List<ParseError> errors) implements Message {
        public SimpleMessage {
            errors = copy(errors);
        }

        @Override
        public List<Declaration> declarations() {
            return List.of();
        }
    }

    /** Declarations followed by a quoted pattern. */
    public record ComplexMessage(List<Declaration> declarations, Pattern pattern, List<ParseError> errors)
            implements Message {
        public ComplexMessage {
            declarations = copy(declarations);
            errors = copy(errors);
        }
    }

    /** Declarations, a {@code .match} statement and its variants. */
    public record SelectMessage(
            List<Declaration> declarations,
            Syntax match,
            List<VariableRef> selectors,
            List<Variant> variants,
            List<ParseError> errors)
            implements Message {
        public SelectMessage {
            declarations = copy(declarations);
            selectors = copy(selectors);
            variants = copy(variants);
            errors = copy(errors);
        }
    }

    /** {@code .input} or {@code .local}. */
    public sealed interface Declaration extends Node {}

    /** {@code .input {$x ...}}; {@code value} is an {@link Expression} or {@link Junk}. */
    public record InputDeclaration(int start, int end, Syntax keyword, Node value) implements Declaration {}

    /**
     * {@code .local $x = {...}}; {@code target} is a {@link VariableRef} or {@link Junk}, {@code
     * value} an {@link Expression} or {@link Junk}.
     */
    public record LocalDeclaration(int start, int end, Syntax keyword, Node target, Syntax equals, Node value)
            implements Declaration {}

    /** Keys ({@link Literal} or {@link CatchallKey}) and a quoted pattern. */
    public record Variant(int start, int end, List<Node> keys, Pattern value) {
        public Variant {
            keys = copy(keys);
        }
    }

    /** The {@code *} key. */
    public record CatchallKey(int start, int end) implements Node {}

    /** Text and placeholders; {@code braces} holds the {@code {{ }}} of a quoted pattern. */
    public record Pattern(int start, int end, List<Node> body, List<Syntax> braces) {
        public Pattern {
            body = copy(body);
            braces = copy(braces);
        }
    }

    public record Text(int start, int end, String value) implements Node {}

    /**
     * A placeholder. {@code arg} is a {@link Literal}, a {@link VariableRef} or {@code null};
     * {@code functionRef} a {@link FunctionRef}, {@link Junk} or {@code null}. A markup
     * placeholder has {@code markup} set instead.
     */
    public record Expression(
            int start,
            int end,
            List<Syntax> braces,
            Node arg,
            Node functionRef,
            Markup markup,
            List<Attribute> attributes)
            implements Node {
        public Expression {
            braces = copy(braces);
            attributes = copy(attributes);
        }
    }

    /** Source text the parser could not make sense of. */
    public record Junk(int start, int end, String source) implements Node {}

    /** A literal; {@code value} is unescaped. */
    public record Literal(int start, int end, boolean quoted, String value) implements Node {}

    /** {@code $name}. */
    public record VariableRef(int start, int end, String name) implements Node {}

    /** {@code :name option=value ...}. */
    public record FunctionRef(int start, int end, Syntax open, List<Syntax> name, List<Option> options)
            implements Node {
        public FunctionRef {
            name = copy(name);
            options = copy(options);
        }
    }

    /**
     * {@code #name}, {@code /name} or {@code #name /}: {@code open} is the {@code #} or {@code /}
     * sigil, {@code close} the trailing {@code /} of a standalone element or {@code null}.
     */
    public record Markup(int start, int end, Syntax open, List<Syntax> name, List<Option> options, Syntax close)
            implements Node {
        public Markup {
            name = copy(name);
            options = copy(options);
        }
    }

    /** {@code name=value}; the value is a {@link Literal} or {@link VariableRef}. */
    public record Option(int start, int end, List<Syntax> name, Node value) {
        public Option {
            name = copy(name);
        }
    }

    /** {@code @name} or {@code @name=literal}. */
    public record Attribute(int start, int end, List<Syntax> name, Literal value) {
        public Attribute {
            name = copy(name);
        }
    }

    /**
     * A token. Identifiers are lists of tokens: {@code [name]} or {@code [ns, :, name]}.
     */
    public record Syntax(int start, int end, String value) {}

    private static <T> List<T> copy(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }
}
