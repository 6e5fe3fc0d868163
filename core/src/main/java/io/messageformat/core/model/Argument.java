package io.messageformat.core.model;

/** Operand of an expression or value of an option. */
public sealed interface Argument permits Literal, VariableRef, ResolvedArgument {}
