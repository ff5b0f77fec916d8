package org.silc.compiler.frontend.ast;

/**
 * Marker for nodes that produce a value when lowered.
 */
public sealed interface Expression extends SyntaxNode
        permits Literal, Identifier, BinaryExpression, LogicalExpression, AssignmentExpression, UnsupportedNode {
}
