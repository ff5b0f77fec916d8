package org.silc.compiler.frontend.ast;

/**
 * A literal value passed through to the output unchanged.
 *
 * @param type  The literal category.
 * @param value The literal text: numbers as written in the source, {@code true}/{@code false},
 *              {@code null}, or the unquoted string content.
 */
public record Literal(Type type, String value) implements Expression {

    /**
     * The literal categories the grammar supports.
     */
    public enum Type {
        NUMBER,
        BOOLEAN,
        STRING,
        NULL
    }

    public static Literal number(String text) {
        return new Literal(Type.NUMBER, text);
    }

    public static Literal bool(boolean value) {
        return new Literal(Type.BOOLEAN, Boolean.toString(value));
    }

    public static Literal string(String content) {
        return new Literal(Type.STRING, content);
    }
}
