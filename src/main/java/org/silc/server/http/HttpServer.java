package org.silc.server.http;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.staticfiles.Location;
import org.silc.service.TranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the Javalin HTTP server: the translate API, CORS and the static browser client.
 *
 * <p>Configuration comes from the {@code silc.server} block:</p>
 * <pre>
 * server {
 *   host = "0.0.0.0"
 *   port = 5000            # 0 picks a free port
 *   cors.enabled = true
 *   static-files { enabled = true, hosted-path = "/", directory = "/web" }
 * }
 * </pre>
 */
public class HttpServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServer.class);

    private static final String API_BASE_PATH = "/";

    private final TranslationService service;
    private final Config options;
    private Javalin app;

    /**
     * @param service The translation service behind the API.
     * @param options The {@code silc.server} configuration block.
     */
    public HttpServer(final TranslationService service, final Config options) {
        this.service = service;
        this.options = options;
    }

    /**
     * Starts the server. Calling it on a running server only logs a warning.
     */
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.getString("host");
        final int port = options.getInt("port");

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} (completed in {} ms)", ctx.method(), ctx.path(), ms);
                }
            });

            if (options.getBoolean("cors.enabled")) {
                config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> rule.anyHost()));
                LOGGER.debug("CORS enabled for any origin");
            }

            if (options.getBoolean("static-files.enabled")) {
                final String hostedPath = options.getString("static-files.hosted-path");
                final String classpathDir = options.getString("static-files.directory");
                LOGGER.debug("Configuring static files from classpath '{}' at URL path '{}'", classpathDir, hostedPath);
                config.staticFiles.add(staticFiles -> {
                    staticFiles.hostedPath = hostedPath;
                    staticFiles.directory = classpathDir;
                    staticFiles.location = Location.CLASSPATH;
                });
            }
        });

        new TranslateController(service, options).registerRoutes(app, API_BASE_PATH);

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    /**
     * Stops the server if it is running.
     */
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return The port the server listens on.
     * @throws IllegalStateException if the server is not running.
     */
    public int port() {
        if (app == null) {
            throw new IllegalStateException("HTTP server is not running.");
        }
        return app.port();
    }
}
