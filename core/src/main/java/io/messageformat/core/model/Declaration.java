package io.messageformat.core.model;

import java.util.Objects;

/** {@code .input} or {@code .local}; binds {@link #name()} to the value of an expression. */
public sealed interface Declaration {

    String name();

    Expression value();

    /** {@code .input {$name ...}}. The expression argument is always a {@link VariableRef}. */
    record InputDeclaration(String name, Expression value) implements Declaration {
        public InputDeclaration {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (!(value.arg() instanceof VariableRef ref) || !ref.name().equals(name)) {
                throw new IllegalArgumentException("Input declaration requires the variable $" + name + " as argument");
            }
        }
    }

    /** {@code .local $name = {...}}. */
    record LocalDeclaration(String name, Expression value) implements Declaration {
        public LocalDeclaration {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }
}
