package org.silc.compiler.frontend.ast;

import java.util.List;

/**
 * The root of a syntax tree: the top-level statements in source order.
 *
 * @param body The top-level statements.
 */
public record Program(List<Statement> body) implements SyntaxNode {

    public Program {
        body = List.copyOf(body);
    }
}
