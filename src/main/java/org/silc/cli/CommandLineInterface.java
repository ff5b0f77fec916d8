package org.silc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.silc.cli.commands.ServeCommand;
import org.silc.cli.commands.TranslateCommand;
import org.silc.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "silc",
    mixinStandardHelpOptions = true,
    version = "silc 1.0",
    description = "silc - lowers script source to three-address code and renders it as Python and C++",
    subcommands = {
        TranslateCommand.class,
        ServeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "silc.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: silc.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("silc");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        final File file = resolveConfigFile();
        try {
            // Config load order: System Props > Env Vars > File > Classpath defaults
            Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                logger.debug("Using configuration file: {}", file.getAbsolutePath());
                base = base.withFallback(ConfigFactory.parseFile(file));
            } else {
                logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
            }
            this.config = base.withFallback(ConfigFactory.load()).resolve();
        } catch (com.typesafe.config.ConfigException e) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Picks the configuration file: {@code --config}, then {@code -Dconfig.file}, then
     * {@value #CONFIG_FILE_NAME} in the working directory.
     *
     * @return The file, or {@code null} to use classpath defaults only.
     */
    private File resolveConfigFile() {
        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            return requireExisting(this.configFile, "--config");
        }
        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return requireExisting(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
        }
        // 3) Then: silc.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }

    private File requireExisting(final File file, final String source) {
        if (!file.exists()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Configuration file specified via " + source + " was not found: " + file.getAbsolutePath());
        }
        return file;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
