package org.silc.compiler.backend.emit;

import java.util.List;

/**
 * The output of one emitter run.
 *
 * @param lines      The emitted lines, indentation included.
 * @param finalDepth The nesting depth after the last instruction.
 * @param maxDepth   The deepest nesting reached.
 */
public record RenderedText(List<String> lines, int finalDepth, int maxDepth) {

    public RenderedText {
        lines = List.copyOf(lines);
    }

    /**
     * @return The lines joined with newlines.
     */
    public String text() {
        return String.join("\n", lines);
    }
}
