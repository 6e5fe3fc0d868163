package io.messageformat.core.function;

import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.FunctionContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative option table of one function: option name → rule. Applying the schema walks the
 * expression options in order and lets each rule validate, coerce and store its value.
 *
 * <p>Options without a rule are ignored unless the schema is {@linkplain Builder#strict() strict},
 * as are {@code null} values and the {@code locale} option (resolved by the functions
 * themselves). A rule that rejects its value causes one {@code
 * bad-option} error and the option is skipped; the function carries on with the remaining
 * options.
 */
public final class OptionSchema {

    /**
     * Validates one option value and writes the coerced result to {@code target}.
     *
     * <p>Throws {@link IllegalArgumentException} to reject the value. A rule may also report
     * other errors itself through the context and return normally.
     */
    @FunctionalInterface
    public interface Rule {
        void apply(FunctionContext ctx, String name, Object value, Map<String, Object> target);
    }

    private final String function;
    private final Map<String, Rule> rules;
    private final boolean strict;

    private OptionSchema(String function, Map<String, Rule> rules, boolean strict) {
        this.function = function;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.strict = strict;
    }

    /** Starts a schema for the function called {@code function} (without the colon). */
    public static Builder builder(String function) {
        return new Builder(function);
    }

    /** Option names this schema recognizes. */
    public Set<String> names() {
        return rules.keySet();
    }

    /**
     * Applies the schema to {@code options}, writing accepted values into {@code target}.
     *
     * @return the rejected options, in the order they were encountered
     */
    public List<OptionViolation> apply(FunctionContext ctx, Map<String, Object> options, Map<String, Object> target) {
        List<OptionViolation> violations = new ArrayList<>();
        if (options == null) {
            return violations;
        }
        for (Map.Entry<String, Object> option : options.entrySet()) {
            String name = option.getKey();
            Object value = option.getValue();
            Rule rule = rules.get(name);
            if (value == null || "locale".equals(name)) {
                continue;
            }
            if (rule == null) {
                if (strict) {
                    reject(ctx, violations, name, value, "Unknown option");
                }
                continue;
            }
            try {
                rule.apply(ctx, name, value, target);
            } catch (IllegalArgumentException e) {
                reject(ctx, violations, name, value, e.getMessage());
            }
        }
        return violations;
    }

    private void reject(
            FunctionContext ctx, List<OptionViolation> violations, String name, Object value, String reason) {
        violations.add(new OptionViolation(name, value, reason));
        ctx.onError(MessageResolutionException.badOption(
                "Value " + describe(value) + " is not valid for :" + function + " option " + name, ctx.source()));
    }

    private static String describe(Object value) {
        return String.valueOf(Coercions.unwrap(value));
    }

    // --- Common rules ---

    /** Stores the value as a string. */
    public static Rule string() {
        return (ctx, name, value, target) -> target.put(name, Coercions.asString(value));
    }

    /** Stores the value as a string restricted to {@code allowed}. */
    public static Rule oneOf(String... allowed) {
        Set<String> values = Set.of(allowed);
        return (ctx, name, value, target) -> {
            String s = Coercions.asString(value);
            if (!values.contains(s)) {
                throw new IllegalArgumentException("Unsupported value: " + s);
            }
            target.put(name, s);
        };
    }

    /** Stores the value as an {@link Integer} between {@code min} and {@code max} inclusive. */
    public static Rule integerInRange(int min, int max) {
        return (ctx, name, value, target) -> {
            int n = Coercions.asPositiveInteger(value);
            if (n < min || n > max) {
                throw new IllegalArgumentException("Out of range " + min + ".." + max + ": " + n);
            }
            target.put(name, n);
        };
    }

    /** Stores the value as a {@link Boolean}. */
    public static Rule bool() {
        return (ctx, name, value, target) -> target.put(name, Coercions.asBoolean(value));
    }

    /** Accepts the option without storing it. */
    public static Rule ignored() {
        return (ctx, name, value, target) -> {};
    }

    /** Builder for {@link OptionSchema}. */
    public static final class Builder {
        private final String function;
        private final Map<String, Rule> rules = new LinkedHashMap<>();
        private boolean strict;

        Builder(String function) {
            this.function = function;
        }

        public Builder option(String name, Rule rule) {
            rules.put(name, rule);
            return this;
        }

        /** Registers {@code rule} for each of {@code names}. */
        public Builder options(Rule rule, String... names) {
            for (String name : names) {
                rules.put(name, rule);
            }
            return this;
        }

        /** Reports options without a rule as {@code bad-option} instead of ignoring them. */
        public Builder strict() {
            this.strict = true;
            return this;
        }

        public OptionSchema build() {
            return new OptionSchema(function, rules, strict);
        }
    }
}
