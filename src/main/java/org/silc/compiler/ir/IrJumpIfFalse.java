package org.silc.compiler.ir;

/**
 * Jumps when the tested operand is false.
 */
public record IrJumpIfFalse(String label) implements IrConditionalBranch {}
