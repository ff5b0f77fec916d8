package org.silc.compiler;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silc.compiler.api.TranslationErrorCode;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.api.TranslationResult;
import org.silc.compiler.backend.emit.syntax.PythonSyntax;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.frontend.parser.ScriptParser;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TranslatorTest {

    private final ScriptParser parser = new ScriptParser();
    private final Translator translator = new Translator();

    private TranslationResult translate(String source) throws TranslationException {
        return translator.translate(parser.parse(source));
    }

    @Test
    @Tag("unit")
    void rendersIntermediateTextAndBothBackends() throws Exception {
        TranslationResult result = translate("var a = 1; if (a < 2) { a = a + 1; }");

        assertThat(result.intermediateText()).isEqualTo(String.join("\n",
                "decl a",
                "mov a, 1",
                "lt t0, a, 2",
                "cmp t0",
                "jmp_if_false L0",
                "add t1, a, 1",
                "mov a, t1",
                "L0:"));
        assertThat(result.output("python")).isEqualTo(String.join("\n",
                "a = None",
                "a = 1",
                "t0 = a < 2",
                "if t0:",
                "    t1 = a + 1",
                "    a = t1",
                "# label L0"));
        assertThat(result.output("cpp")).contains("    int t0, t1;", "    if (t0) {", "        a = t1;", "    return 0;");
        assertThat(result.sections()).containsOnlyKeys("sil", "python", "cpp");
        assertThat(result.sections().keySet()).containsExactly("sil", "python", "cpp");
    }

    @Test
    @Tag("unit")
    void rendersOnlyTheConfiguredBackends() throws Exception {
        Translator pythonOnly = new Translator(List.of(new PythonSyntax("  ")));
        TranslationResult result = pythonOnly.translate(parser.parse("while (a) { a = a - 1; }"));

        assertThat(pythonOnly.backendNames()).containsExactly("python");
        assertThat(result.backendOutputs()).containsOnlyKeys("python");
        assertThat(result.output("python")).contains("  t0 = a - 1");
        assertThatThrownBy(() -> result.output("cpp")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @Tag("unit")
    void failsWithoutPartialResultOnUnsupportedConstruct() throws Exception {
        Program program = parser.parse("var a = 1; a = -a;");

        assertThatThrownBy(() -> translator.translate(program))
                .isInstanceOf(TranslationException.class)
                .extracting(e -> ((TranslationException) e).getErrorCode())
                .isEqualTo(TranslationErrorCode.UNSUPPORTED_CONSTRUCT);
    }

    @Test
    @Tag("unit")
    void translationIsDeterministic() throws Exception {
        String source = "function f(n) { var r = 0; for (var i = 0; i < n && r < 100; i = i + 1) { r = r + i; } return r; }";

        TranslationResult first = translate(source);
        TranslationResult second = translate(source);

        assertThat(second.intermediateText()).isEqualTo(first.intermediateText());
        assertThat(second.backendOutputs()).isEqualTo(first.backendOutputs());
    }

    @Test
    @Tag("unit")
    void shortCircuitInsideLoopConditionRendersInBothBackends() throws Exception {
        TranslationResult result = translate("while (a < 10 && b) { a = a + 1; }");

        assertThat(result.output("python")).isEqualTo(String.join("\n",
                "# label L0",
                "t0 = a < 10",
                "if t0:",
                "    t1 = b",
                "    # jump L3",
                "# label L2",
                "t1 = t0",
                "# label L3",
                "if t1:",
                "    t2 = a + 1",
                "    a = t2",
                "    # jump L0",
                "# label L1"));
        assertThat(result.output("cpp")).startsWith(String.join("\n",
                "#include <iostream>",
                "using namespace std;",
                "",
                "int main() {",
                "    int t0, t1, t2;"));
    }
}
