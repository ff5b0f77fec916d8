package org.silc.compiler.ir;

/**
 * Jumps when the tested operand is true.
 */
public record IrJumpIfTrue(String label) implements IrConditionalBranch {}
