package org.silc.compiler.frontend.ast;

/**
 * @param test       The condition.
 * @param consequent The statement run when the condition holds.
 * @param alternate  The else branch, or {@code null}.
 */
public record IfStatement(Expression test, Statement consequent, Statement alternate) implements Statement {
}
