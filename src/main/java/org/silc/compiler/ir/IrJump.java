package org.silc.compiler.ir;

/**
 * Unconditional jump.
 */
public record IrJump(String label) implements IrBranch {}
