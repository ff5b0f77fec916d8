package org.silc.compiler.ir;

/**
 * Declares a source-level variable.
 */
public record IrDecl(String name) implements IrItem {}
