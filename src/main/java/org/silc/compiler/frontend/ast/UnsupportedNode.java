package org.silc.compiler.frontend.ast;

/**
 * Placeholder for a parsed construct outside the supported grammar. It can stand in either
 * statement or expression position so that the parser adapter never drops input silently;
 * lowering rejects it with the original kind name.
 *
 * @param kind The parser's name for the construct, e.g. {@code "UnaryExpression"}.
 */
public record UnsupportedNode(String kind) implements Statement, Expression {

    @Override
    public String kind() {
        return kind;
    }
}
