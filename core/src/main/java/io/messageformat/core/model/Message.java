package io.messageformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A message: declarations and either a single pattern or a {@code .match} over selectors. Built
 * once per syntax tree by {@link FromCst} and immutable after that.
 */
public sealed interface Message {

    List<Declaration> declarations();

    /** Declarations followed by one pattern. */
    record PatternMessage(List<Declaration> declarations, Pattern pattern) implements Message {
        public PatternMessage {
            declarations = declarations != null ? List.copyOf(declarations) : List.of();
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    /**
     * Declarations, selectors and variants. Each selector names a declared variable; variants are
     * kept in source order.
     */
    record SelectMessage(List<Declaration> declarations, List<VariableRef> selectors, List<Variant> variants)
            implements Message {
        public SelectMessage {
            declarations = declarations != null ? List.copyOf(declarations) : List.of();
            selectors = selectors != null ? List.copyOf(selectors) : List.of();
            variants = variants != null ? List.copyOf(variants) : List.of();
        }
    }
}
