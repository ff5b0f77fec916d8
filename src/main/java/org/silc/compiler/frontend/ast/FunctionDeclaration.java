package org.silc.compiler.frontend.ast;

import java.util.List;

/**
 * A named function with simple parameters.
 *
 * @param name       The function name.
 * @param parameters The formal parameter names in declaration order.
 * @param body       The function body.
 */
public record FunctionDeclaration(String name, List<String> parameters, BlockStatement body) implements Statement {

    public FunctionDeclaration {
        parameters = List.copyOf(parameters);
    }
}
