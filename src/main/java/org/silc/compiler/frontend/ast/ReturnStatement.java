package org.silc.compiler.frontend.ast;

/**
 * @param argument The returned expression, or {@code null} for a bare {@code return}.
 */
public record ReturnStatement(Expression argument) implements Statement {
}
