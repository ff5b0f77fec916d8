package org.silc.compiler.frontend.ast;

/**
 * A short-circuiting {@code &&} or {@code ||} expression.
 *
 * @param operator The operator symbol.
 * @param left     The left operand, always evaluated.
 * @param right    The right operand, evaluated only when the left does not decide the result.
 */
public record LogicalExpression(String operator, Expression left, Expression right) implements Expression {
}
