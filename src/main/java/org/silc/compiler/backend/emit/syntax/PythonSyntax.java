package org.silc.compiler.backend.emit.syntax;

import org.silc.compiler.backend.emit.IBackendSyntax;
import org.silc.compiler.ir.ArithmeticOp;
import org.silc.compiler.ir.CompareOp;
import org.silc.compiler.ir.IrLiteral;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Script-style, dynamically typed backend. Blocks are delimited by indentation alone, so
 * closing a block emits no line.
 */
public class PythonSyntax implements IBackendSyntax {

    public static final String NAME = "python";

    private static final Map<ArithmeticOp, String> ARITHMETIC = new EnumMap<>(ArithmeticOp.class);
    private static final Map<CompareOp, String> COMPARE = new EnumMap<>(CompareOp.class);

    static {
        ARITHMETIC.put(ArithmeticOp.ADD, "+");
        ARITHMETIC.put(ArithmeticOp.SUB, "-");
        ARITHMETIC.put(ArithmeticOp.MUL, "*");
        ARITHMETIC.put(ArithmeticOp.DIV, "/");
        COMPARE.put(CompareOp.LT, "<");
        COMPARE.put(CompareOp.GT, ">");
        COMPARE.put(CompareOp.LTE, "<=");
        COMPARE.put(CompareOp.GTE, ">=");
        COMPARE.put(CompareOp.EQ, "==");
        COMPARE.put(CompareOp.NEQ, "!=");
    }

    private final String indent;

    public PythonSyntax(String indent) {
        this.indent = indent;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String indentUnit() {
        return indent;
    }

    @Override
    public String declaration(String name) {
        return name + " = None";
    }

    @Override
    public String assignment(String dest, String source) {
        return dest + " = " + source;
    }

    @Override
    public String binaryOperation(String dest, String lhs, String operator, String rhs) {
        return dest + " = " + lhs + " " + operator + " " + rhs;
    }

    @Override
    public String spell(ArithmeticOp op) {
        return ARITHMETIC.get(op);
    }

    @Override
    public String spell(CompareOp op) {
        return COMPARE.get(op);
    }

    @Override
    public String literal(IrLiteral literal) {
        switch (literal.type()) {
            case BOOLEAN:
                return "true".equals(literal.value()) ? "True" : "False";
            case NULL:
                return "None";
            default:
                return literal.text();
        }
    }

    @Override
    public String conditionOpener(String operand, boolean whenTrue) {
        return whenTrue ? "if " + operand + ":" : "if not " + operand + ":";
    }

    @Override
    public Optional<String> blockCloser() {
        return Optional.empty();
    }

    @Override
    public Optional<String> emptyBlockStatement() {
        return Optional.of("pass");
    }

    @Override
    public String jumpMarker(String label) {
        return "# jump " + label;
    }

    @Override
    public String labelMarker(String label) {
        return "# label " + label;
    }

    @Override
    public String functionOpener(String name, List<String> parameters) {
        return "def " + name + "(" + String.join(", ", parameters) + "):";
    }

    @Override
    public Optional<String> functionCloser() {
        return Optional.empty();
    }

    @Override
    public String returnStatement(String operand) {
        return operand == null ? "return" : "return " + operand;
    }
}
