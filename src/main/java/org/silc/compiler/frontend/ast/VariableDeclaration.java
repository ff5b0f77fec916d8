package org.silc.compiler.frontend.ast;

import java.util.List;

/**
 * A {@code var}, {@code let} or {@code const} statement with one or more declarators.
 *
 * @param declarations The declarators in source order.
 */
public record VariableDeclaration(List<VariableDeclarator> declarations) implements Statement {

    public VariableDeclaration {
        declarations = List.copyOf(declarations);
    }
}
