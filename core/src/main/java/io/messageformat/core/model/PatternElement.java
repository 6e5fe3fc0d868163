package io.messageformat.core.model;

/** One element of a {@link Pattern}. */
public sealed interface PatternElement permits TextElement, Expression, Markup {}
