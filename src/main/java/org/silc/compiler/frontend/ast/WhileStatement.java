package org.silc.compiler.frontend.ast;

/**
 * @param test The loop condition, checked before every iteration.
 * @param body The loop body.
 */
public record WhileStatement(Expression test, Statement body) implements Statement {
}
