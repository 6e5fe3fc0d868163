package io.messageformat.core.model;

/** Key of a variant: a {@link Literal} or the {@link CatchallKey}. */
public sealed interface VariantKey permits Literal, CatchallKey {}
