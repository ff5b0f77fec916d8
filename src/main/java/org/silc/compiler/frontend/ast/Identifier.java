package org.silc.compiler.frontend.ast;

/**
 * A reference to a source-level variable.
 *
 * @param name The variable name.
 */
public record Identifier(String name) implements Expression {
}
