package org.silc.compiler.frontend.ast;

/**
 * The base interface for all nodes of the syntax tree handed to the translator.
 * <p>
 * The hierarchy is closed: every supported node kind is a record in this package, and anything
 * the parser produced outside the supported grammar arrives as an {@link UnsupportedNode}.
 * Nodes are immutable and owned by the caller; the translator never modifies them.
 */
public sealed interface SyntaxNode permits Program, Statement, Expression, VariableDeclarator {

    /**
     * Returns the name of this node's kind, used in diagnostics.
     *
     * @return The node kind, e.g. {@code "IfStatement"}.
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
