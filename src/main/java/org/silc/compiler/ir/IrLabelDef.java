package org.silc.compiler.ir;

/**
 * Label definition in the IR stream.
 */
public record IrLabelDef(String name) implements IrItem {}
