package io.messageformat.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What a message needs at format time: the functions it calls and the variables it expects from
 * the caller. Locally declared variables are not included.
 */
public record ValidationResult(Set<String> functions, Set<String> variables) {

    public ValidationResult {
        functions = functions != null ? Collections.unmodifiableSet(new LinkedHashSet<>(functions)) : Set.of();
        variables = variables != null ? Collections.unmodifiableSet(new LinkedHashSet<>(variables)) : Set.of();
    }
}
