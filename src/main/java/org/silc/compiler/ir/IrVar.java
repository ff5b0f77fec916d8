package org.silc.compiler.ir;

/**
 * A source-level variable or parameter.
 */
public record IrVar(String name) implements IrOperand {

    @Override
    public String text() {
        return name;
    }
}
