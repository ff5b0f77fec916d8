package org.silc.compiler.api;

import org.silc.compiler.frontend.ast.Program;

import java.util.List;

/**
 * Defines the public interface of the translator core.
 * <p>
 * Implementations hold no per-translation state, so one instance may serve concurrent callers.
 */
public interface ITranslator {

    /**
     * Lowers the syntax tree and renders the result with every configured backend.
     *
     * @param program The syntax tree produced by the parser.
     * @return The intermediate program and the text of each backend.
     * @throws TranslationException if the tree uses an unsupported construct or operator, assigns to
     *                              something other than a variable, or yields malformed control flow.
     */
    TranslationResult translate(Program program) throws TranslationException;

    /**
     * @return The names of the backends this translator renders, in output order.
     */
    List<String> backendNames();
}
