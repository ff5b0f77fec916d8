package org.silc.compiler.ir;

/**
 * Returns from the current function.
 *
 * @param operand The returned value, or {@code null} for a bare return.
 */
public record IrReturn(IrOperand operand) implements IrItem {

    public boolean hasOperand() {
        return operand != null;
    }
}
