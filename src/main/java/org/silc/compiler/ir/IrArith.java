package org.silc.compiler.ir;

/**
 * {@code dest = lhs op rhs} for an arithmetic operator.
 */
public record IrArith(ArithmeticOp op, IrTemp dest, IrOperand lhs, IrOperand rhs) implements IrItem {}
