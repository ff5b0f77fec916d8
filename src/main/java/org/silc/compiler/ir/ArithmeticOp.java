package org.silc.compiler.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Arithmetic operators of the intermediate form.
 */
public enum ArithmeticOp {
    ADD("add", "+"),
    SUB("sub", "-"),
    MUL("mul", "*"),
    DIV("div", "/");

    private final String mnemonic;
    private final String symbol;

    ArithmeticOp(String mnemonic, String symbol) {
        this.mnemonic = mnemonic;
        this.symbol = symbol;
    }

    public String mnemonic() {
        return mnemonic;
    }

    /**
     * @return The source-level operator symbol.
     */
    public String symbol() {
        return symbol;
    }

    public static Optional<ArithmeticOp> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
