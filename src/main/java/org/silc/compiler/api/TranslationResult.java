package org.silc.compiler.api;

import org.silc.compiler.ir.IrProgram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The output of one translation: the intermediate program, its textual form, and the text
 * produced by every configured backend.
 *
 * @param program          The lowered instruction sequence.
 * @param intermediateText The instruction sequence rendered one instruction per line.
 * @param backendOutputs   Backend name to rendered text, in backend configuration order.
 */
public record TranslationResult(IrProgram program, String intermediateText, Map<String, String> backendOutputs) {

    /** Section name of the intermediate text. */
    public static final String INTERMEDIATE_SECTION = "sil";

    public TranslationResult {
        backendOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(backendOutputs));
    }

    /**
     * Returns the text rendered by the named backend.
     *
     * @param backendName The backend name, e.g. {@code "python"}.
     * @return The rendered text.
     * @throws NoSuchElementException if the backend did not take part in this translation.
     */
    public String output(String backendName) {
        String text = backendOutputs.get(backendName);
        if (text == null) {
            throw new NoSuchElementException("No output for backend '" + backendName + "'");
        }
        return text;
    }

    /**
     * Returns every text block keyed by section name: {@value #INTERMEDIATE_SECTION} first, then one
     * entry per backend in configuration order.
     *
     * @return An ordered, unmodifiable map of section name to text.
     */
    public Map<String, String> sections() {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put(INTERMEDIATE_SECTION, intermediateText);
        sections.putAll(backendOutputs);
        return Collections.unmodifiableMap(sections);
    }
}
