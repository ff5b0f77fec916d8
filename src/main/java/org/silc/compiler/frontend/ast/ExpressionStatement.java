package org.silc.compiler.frontend.ast;

/**
 * An expression evaluated for its effects.
 *
 * @param expression The wrapped expression.
 */
public record ExpressionStatement(Expression expression) implements Statement {
}
