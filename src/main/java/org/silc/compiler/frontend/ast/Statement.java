package org.silc.compiler.frontend.ast;

/**
 * Marker for nodes that may appear in statement position.
 */
public sealed interface Statement extends SyntaxNode
        permits VariableDeclaration, ExpressionStatement, BlockStatement, IfStatement,
                WhileStatement, ForStatement, FunctionDeclaration, ReturnStatement, UnsupportedNode {
}
