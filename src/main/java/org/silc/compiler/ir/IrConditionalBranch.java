package org.silc.compiler.ir;

/**
 * A branch taken depending on the operand of the immediately preceding {@link IrCmp}.
 */
public sealed interface IrConditionalBranch extends IrBranch permits IrJumpIfFalse, IrJumpIfTrue {
}
