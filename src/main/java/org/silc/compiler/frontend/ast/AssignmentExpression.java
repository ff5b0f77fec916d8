package org.silc.compiler.frontend.ast;

/**
 * An assignment. Only plain {@code =} is lowered; the operator is kept so that compound
 * forms can be reported precisely.
 *
 * @param operator The assignment operator, e.g. {@code "="} or {@code "+="}.
 * @param target   The assigned expression; must be an {@link Identifier} to be lowered.
 * @param value    The assigned value.
 */
public record AssignmentExpression(String operator, Expression target, Expression value) implements Expression {

    public static AssignmentExpression assign(Expression target, Expression value) {
        return new AssignmentExpression("=", target, value);
    }
}
