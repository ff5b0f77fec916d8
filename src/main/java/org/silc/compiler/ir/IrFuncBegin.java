package org.silc.compiler.ir;

/**
 * Opens a function. Its {@link IrParam}s follow immediately.
 */
public record IrFuncBegin(String name) implements IrItem {}
