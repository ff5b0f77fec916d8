package org.silc.compiler.frontend.ast;

/**
 * A single declared name with an optional initializer.
 *
 * @param name        The declared variable name.
 * @param initializer The initializer expression, or {@code null} if absent.
 */
public record VariableDeclarator(String name, Expression initializer) implements SyntaxNode {
}
