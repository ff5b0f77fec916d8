package org.silc.compiler.frontend.ast;

/**
 * An arithmetic or comparison expression.
 *
 * @param operator The operator symbol as written, e.g. {@code "+"} or {@code "<="}.
 * @param left     The left operand.
 * @param right    The right operand.
 */
public record BinaryExpression(String operator, Expression left, Expression right) implements Expression {
}
