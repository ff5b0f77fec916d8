package org.silc.compiler.ir;

/**
 * Base type for instruction operands: a literal, a source-level variable, or a compiler temporary.
 */
public sealed interface IrOperand permits IrLiteral, IrVar, IrTemp {

    /**
     * @return The operand as written in the intermediate text form.
     */
    String text();
}
