package org.silc.compiler.ir;

/**
 * Closes the innermost open function.
 */
public record IrFuncEnd() implements IrItem {}
