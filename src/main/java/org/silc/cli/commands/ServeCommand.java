package org.silc.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;
import org.silc.cli.CommandLineInterface;
import org.silc.server.http.HttpServer;
import org.silc.service.TranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "serve",
    description = "Starts the HTTP translation server and the browser client."
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--host", description = "Overrides silc.server.host.")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Overrides silc.server.port.")
    private Integer port;

    @Override
    public Integer call() throws Exception {
        final Config silc = parent.getConfig().getConfig("silc");
        Config serverConfig = silc.getConfig("server");
        if (host != null) {
            serverConfig = serverConfig.withValue("host", ConfigValueFactory.fromAnyRef(host));
        }
        if (port != null) {
            serverConfig = serverConfig.withValue("port", ConfigValueFactory.fromAnyRef(port));
        }

        final HttpServer server = new HttpServer(TranslationService.fromConfig(silc), serverConfig);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "silc-shutdown"));

        // Keep the main thread alive; the shutdown hook stops the server.
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Server stopped gracefully.");
        }
        return 0;
    }
}
