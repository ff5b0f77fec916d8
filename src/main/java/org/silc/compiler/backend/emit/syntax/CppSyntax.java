package org.silc.compiler.backend.emit.syntax;

import org.silc.compiler.backend.emit.IBackendSyntax;
import org.silc.compiler.ir.ArithmeticOp;
import org.silc.compiler.ir.CompareOp;
import org.silc.compiler.ir.IrLiteral;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Brace-delimited, statically typed backend. The program body is wrapped in {@code main} and
 * functions become lambdas capturing by reference, so they can sit inside {@code main} and
 * see the variables declared before them. Every variable is typed {@code int}.
 */
public class CppSyntax implements IBackendSyntax {

    public static final String NAME = "cpp";

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

    public CppSyntax(String indent) {
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
    public int baseDepth() {
        return 1;
    }

    @Override
    public List<String> prologue() {
        return List.of("#include <iostream>", "using namespace std;", "", "int main() {");
    }

    @Override
    public List<String> epilogue() {
        return List.of(indent + "return 0;", "}");
    }

    @Override
    public String declaration(String name) {
        return "int " + name + ";";
    }

    @Override
    public String assignment(String dest, String source) {
        return dest + " = " + source + ";";
    }

    @Override
    public String binaryOperation(String dest, String lhs, String operator, String rhs) {
        return dest + " = " + lhs + " " + operator + " " + rhs + ";";
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
        if (literal.type() == IrLiteral.Type.NULL) {
            return "nullptr";
        }
        // numbers, booleans and quoted strings are already valid C++ tokens
        return literal.text();
    }

    @Override
    public String conditionOpener(String operand, boolean whenTrue) {
        return whenTrue ? "if (" + operand + ") {" : "if (!" + operand + ") {";
    }

    @Override
    public Optional<String> blockCloser() {
        return Optional.of("}");
    }

    @Override
    public Optional<String> emptyBlockStatement() {
        return Optional.empty();
    }

    @Override
    public String jumpMarker(String label) {
        return "// jump " + label;
    }

    @Override
    public String labelMarker(String label) {
        return "// label " + label;
    }

    @Override
    public String functionOpener(String name, List<String> parameters) {
        String params = parameters.stream().map(p -> "int " + p).collect(Collectors.joining(", "));
        return "auto " + name + " = [&](" + params + ") -> int {";
    }

    @Override
    public Optional<String> functionCloser() {
        return Optional.of("};");
    }

    @Override
    public String returnStatement(String operand) {
        return operand == null ? "return 0;" : "return " + operand + ";";
    }

    @Override
    public Optional<String> temporaryDeclaration(List<String> temporaries) {
        return Optional.of("int " + String.join(", ", temporaries) + ";");
    }
}
