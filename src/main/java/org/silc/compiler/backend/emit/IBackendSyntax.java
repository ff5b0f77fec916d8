package org.silc.compiler.backend.emit;

import org.silc.compiler.ir.ArithmeticOp;
import org.silc.compiler.ir.CompareOp;
import org.silc.compiler.ir.IrLiteral;

import java.util.List;
import java.util.Optional;

/**
 * The surface-syntax table of one backend. {@link StructuredEmitter} owns all nesting decisions
 * and asks the table only how a line is spelled. Lines are returned without indentation.
 */
public interface IBackendSyntax {

    /**
     * @return The backend name used in configuration and output maps, e.g. {@code "python"}.
     */
    String name();

    /**
     * @return The text of one indentation level.
     */
    String indentUnit();

    /**
     * @return The nesting depth of top-level statements.
     */
    default int baseDepth() {
        return 0;
    }

    /**
     * @return Lines emitted before the program body, unindented.
     */
    default List<String> prologue() {
        return List.of();
    }

    /**
     * @return Lines emitted after the program body, already indented.
     */
    default List<String> epilogue() {
        return List.of();
    }

    String declaration(String name);

    String assignment(String dest, String source);

    /**
     * @return {@code dest = lhs <operator> rhs} in this backend's statement syntax.
     */
    String binaryOperation(String dest, String lhs, String operator, String rhs);

    String spell(ArithmeticOp op);

    String spell(CompareOp op);

    String literal(IrLiteral literal);

    /**
     * Opens a conditional block.
     *
     * @param operand  The tested operand.
     * @param whenTrue {@code true} if the block runs when the operand holds (the branch jumps on false),
     *                 {@code false} if it runs when the operand does not hold.
     * @return The opening line.
     */
    String conditionOpener(String operand, boolean whenTrue);

    /**
     * @return The line closing a block at the outer depth, if the syntax has one.
     */
    Optional<String> blockCloser();

    /**
     * @return The statement placed in a block that would otherwise hold no statement, if the syntax needs one.
     */
    Optional<String> emptyBlockStatement();

    String jumpMarker(String label);

    String labelMarker(String label);

    String functionOpener(String name, List<String> parameters);

    /**
     * @return The line closing a function at the outer depth, if the syntax has one.
     */
    Optional<String> functionCloser();

    /**
     * @param operand The returned operand, or {@code null} for a bare return.
     * @return The return statement.
     */
    String returnStatement(String operand);

    /**
     * Declares the temporaries assigned in one frame (the program body or a function body).
     *
     * @param temporaries Temporary names in order of first assignment; never empty.
     * @return The declaration line, or empty if the syntax declares temporaries implicitly.
     */
    default Optional<String> temporaryDeclaration(List<String> temporaries) {
        return Optional.empty();
    }
}
