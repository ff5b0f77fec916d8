package org.silc.compiler.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators of the intermediate form. Each yields a boolean into a temporary.
 */
public enum CompareOp {
    LT("lt", "<"),
    GT("gt", ">"),
    LTE("lte", "<="),
    GTE("gte", ">="),
    EQ("eq", "=="),
    NEQ("neq", "!=");

    private final String mnemonic;
    private final String symbol;

    CompareOp(String mnemonic, String symbol) {
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

    public static Optional<CompareOp> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
