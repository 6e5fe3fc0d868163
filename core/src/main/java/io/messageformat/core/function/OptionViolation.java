package io.messageformat.core.function;

/** An option whose value was rejected and skipped. */
public record OptionViolation(String name, Object value, String reason) {}
