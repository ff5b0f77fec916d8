package org.silc.compiler.frontend.ast;

/**
 * A three-clause {@code for} loop. Every clause is optional.
 *
 * @param init   A {@link VariableDeclaration} or an {@link Expression}, or {@code null}.
 * @param test   The loop condition, or {@code null} for an unconditional loop.
 * @param update The expression evaluated after each iteration, or {@code null}.
 * @param body   The loop body.
 */
public record ForStatement(SyntaxNode init, Expression test, Expression update, Statement body) implements Statement {
}
