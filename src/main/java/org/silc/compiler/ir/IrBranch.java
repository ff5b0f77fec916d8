package org.silc.compiler.ir;

/**
 * An instruction that transfers control to a label.
 */
public sealed interface IrBranch extends IrItem permits IrJump, IrConditionalBranch {

    /**
     * @return The target label.
     */
    String label();
}
