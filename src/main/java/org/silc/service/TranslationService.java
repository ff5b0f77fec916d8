package org.silc.service;

import com.typesafe.config.Config;
import org.silc.compiler.Translator;
import org.silc.compiler.api.ITranslator;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.api.TranslationResult;
import org.silc.compiler.backend.emit.BackendRegistry;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.frontend.parser.ScriptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns raw source text into a translation: parse with Rhino, then lower and render.
 * This is the single entry point shared by the HTTP endpoint and the command line.
 * <p>
 * Thread-safe; both collaborators hold no per-call state.
 */
public class TranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);

    private final ScriptParser parser;
    private final ITranslator translator;

    public TranslationService(final ScriptParser parser, final ITranslator translator) {
        this.parser = parser;
        this.translator = translator;
    }

    /**
     * Builds the service from the {@code silc} configuration block.
     *
     * @param config The {@code silc} block, with {@code backends}, {@code emit.indent} and
     *               {@code parser.language-version}.
     * @return A ready service.
     * @throws IllegalArgumentException if {@code backends} names an unknown backend.
     */
    public static TranslationService fromConfig(final Config config) {
        final String indent = config.getString("emit.indent");
        final List<String> backends = config.getStringList("backends");
        final int languageVersion = config.getInt("parser.language-version");

        final BackendRegistry registry = BackendRegistry.initializeWithDefaults(indent);
        final Translator translator = new Translator(registry.select(backends));
        LOGGER.debug("Translation service configured with backends {} and language version {}", backends, languageVersion);
        return new TranslationService(new ScriptParser(languageVersion), translator);
    }

    /**
     * Parses and translates the given source.
     *
     * @param source     The source text.
     * @param sourceName A name for parser messages, e.g. the file name.
     * @return The translation result.
     * @throws TranslationException on a syntax error or any translation failure.
     */
    public TranslationResult translate(final String source, final String sourceName) throws TranslationException {
        try {
            final Program program = parser.parse(source, sourceName);
            return translator.translate(program);
        } catch (TranslationException e) {
            LOGGER.warn("Translation of {} failed [{}]: {}", sourceName, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    /**
     * @return The configured backend names, in output order.
     */
    public List<String> backendNames() {
        return translator.backendNames();
    }
}
