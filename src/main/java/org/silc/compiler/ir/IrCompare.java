package org.silc.compiler.ir;

/**
 * {@code dest = lhs op rhs} for a comparison operator.
 */
public record IrCompare(CompareOp op, IrTemp dest, IrOperand lhs, IrOperand rhs) implements IrItem {}
