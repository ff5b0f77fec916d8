package org.silc.compiler.ir;

public record IrParam(String name) implements IrItem {}
