package org.silc.compiler.frontend.ast;

import java.util.List;

/**
 * A braced statement list.
 *
 * @param body The statements in source order.
 */
public record BlockStatement(List<Statement> body) implements Statement {

    public BlockStatement {
        body = List.copyOf(body);
    }
}
