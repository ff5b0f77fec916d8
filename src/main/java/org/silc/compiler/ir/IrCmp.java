package org.silc.compiler.ir;

/**
 * Selects the operand tested by the conditional branch that immediately follows.
 */
public record IrCmp(IrOperand operand) implements IrItem {}
