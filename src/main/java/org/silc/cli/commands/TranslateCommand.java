package org.silc.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.silc.cli.CommandLineInterface;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.api.TranslationResult;
import org.silc.service.TranslationService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "translate", description = "Translates a script file and prints the intermediate code and backend output.")
public class TranslateCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the script file.")
    private File file;

    @Option(names = {"-t", "--target"}, defaultValue = "all",
            description = "Section to print: sil, a backend name, or all (default: ${DEFAULT-VALUE}).")
    private String target;

    @Option(names = "--json", description = "Print all sections as one JSON object, as the HTTP API does.")
    private boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        final TranslationService service = TranslationService.fromConfig(parent.getConfig().getConfig("silc"));
        final PrintWriter out = spec.commandLine().getOut();

        final TranslationResult result;
        try {
            result = service.translate(source, file.getName());
        } catch (TranslationException e) {
            spec.commandLine().getErr().println(file.getName() + ": " + e.getMessage());
            return 1;
        }

        final Map<String, String> sections = result.sections();
        if (json) {
            final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            out.println(mapper.writeValueAsString(sections));
        } else if ("all".equals(target)) {
            sections.forEach((name, text) -> {
                out.println("== " + name + " ==");
                out.println(text);
            });
        } else if (sections.containsKey(target)) {
            out.println(sections.get(target));
        } else {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Unknown target '" + target + "'; expected one of " + sections.keySet() + " or all");
        }
        out.flush();
        return 0;
    }
}
