package org.silc.service;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.silc.compiler.api.TranslationErrorCode;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.api.TranslationResult;
import org.silc.junit.extensions.logging.ExpectLog;
import org.silc.junit.extensions.logging.LogLevel;
import org.silc.junit.extensions.logging.LogWatchExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(LogWatchExtension.class)
public class TranslationServiceTest {

    private static Config defaults() {
        return ConfigFactory.load().getConfig("silc");
    }

    @Test
    @Tag("unit")
    void defaultsRenderBothBackends() throws Exception {
        TranslationService service = TranslationService.fromConfig(defaults());

        TranslationResult result = service.translate("var x = 2 * 3;", "inline.js");

        assertThat(service.backendNames()).containsExactly("python", "cpp");
        assertThat(result.intermediateText()).isEqualTo("decl x\nmul t0, 2, 3\nmov x, t0");
        assertThat(result.output("python")).isEqualTo("x = None\nt0 = 2 * 3\nx = t0");
    }

    @Test
    @Tag("unit")
    void honoursConfiguredBackendsAndIndent() throws Exception {
        Config config = defaults()
                .withValue("backends", ConfigValueFactory.fromIterable(List.of("cpp")))
                .withValue("emit.indent", ConfigValueFactory.fromAnyRef("\t"));
        TranslationService service = TranslationService.fromConfig(config);

        TranslationResult result = service.translate("var x;", "inline.js");

        assertThat(result.sections().keySet()).containsExactly("sil", "cpp");
        assertThat(result.output("cpp")).contains("\tint x;");
    }

    @Test
    @Tag("unit")
    void rejectsUnknownBackendInConfiguration() {
        Config config = defaults().withValue("backends", ConfigValueFactory.fromIterable(List.of("python", "java")));

        assertThatThrownBy(() -> TranslationService.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("java");
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Translation of bad\\.js failed \\[UNSUPPORTED_OPERATOR\\].*")
    void logsAndRethrowsFailures() {
        TranslationService service = TranslationService.fromConfig(defaults());

        assertThatThrownBy(() -> service.translate("var a = b % 2;", "bad.js"))
                .isInstanceOf(TranslationException.class)
                .extracting(e -> ((TranslationException) e).getSubject())
                .isEqualTo("%");
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*\\[SYNTAX_ERROR\\].*")
    void reportsSyntaxErrors() {
        TranslationService service = TranslationService.fromConfig(defaults());

        assertThatThrownBy(() -> service.translate("if (", "broken.js"))
                .isInstanceOf(TranslationException.class)
                .extracting(e -> ((TranslationException) e).getErrorCode())
                .isEqualTo(TranslationErrorCode.SYNTAX_ERROR);
    }
}
