package org.silc.compiler.ir;

/**
 * A compiler-introduced temporary holding an intermediate result. Never referenced by source code.
 */
public record IrTemp(String name) implements IrOperand {

    @Override
    public String text() {
        return name;
    }
}
