package org.silc.compiler.ir;

/**
 * Copies {@code source} into {@code dest}, which is a variable or a temporary.
 */
public record IrMov(IrOperand dest, IrOperand source) implements IrItem {}
