package org.silc.compiler.ir;

/**
 * A literal operand. Backends choose their own spelling for booleans, null and strings.
 *
 * @param type  The literal category.
 * @param value Numbers as written, {@code true}/{@code false}, {@code null}, or the unquoted string content.
 */
public record IrLiteral(Type type, String value) implements IrOperand {

    public enum Type {
        NUMBER,
        BOOLEAN,
        STRING,
        NULL
    }

    @Override
    public String text() {
        return type == Type.STRING ? quote(value) : value;
    }

    /**
     * Quotes a string with double quotes, escaping quotes, backslashes and control characters.
     *
     * @param content The raw string content.
     * @return The quoted literal.
     */
    public static String quote(String content) {
        StringBuilder sb = new StringBuilder(content.length() + 2).append('"');
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
