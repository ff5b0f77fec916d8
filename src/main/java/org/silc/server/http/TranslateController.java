package org.silc.server.http;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.api.TranslationResult;
import org.silc.server.http.dto.BackendsResponseDto;
import org.silc.server.http.dto.ErrorResponseDto;
import org.silc.server.http.dto.TranslateRequestDto;
import org.silc.service.TranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Controller that exposes the translator over HTTP. A translation answers with one JSON
 * field per text block: the intermediate form and each configured backend.
 */
public class TranslateController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslateController.class);

    /** Error code for a request without source text. */
    public static final String EMPTY_SOURCE = "EMPTY_SOURCE";
    /** Error code for a body that is not the expected JSON object. */
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    /** Error code for unexpected failures. */
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final String DEFAULT_SOURCE_NAME = "request";

    private final String sourceName;

    /**
     * Constructs a new TranslateController.
     *
     * @param service The translation service.
     * @param options The configuration for this controller; {@code source-name} names submitted
     *                code in parser messages and logs.
     */
    public TranslateController(final TranslationService service, final Config options) {
        super(service, options);
        this.sourceName = options.hasPath("source-name") ? options.getString("source-name") : DEFAULT_SOURCE_NAME;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String fullPath = (basePath + "/").replaceAll("//", "/");

        app.post(fullPath + "translate", this::handleTranslate);
        app.get(fullPath + "translate/backends", this::getBackends);

        // Exception handling
        app.exception(TranslationException.class, (e, ctx) -> {
            LOGGER.debug("Translation rejected for request {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(
                HttpStatus.BAD_REQUEST.getCode(),
                HttpStatus.BAD_REQUEST.getMessage(),
                e.getMessage(),
                e.getErrorCode().name()
            ));
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of(
                HttpStatus.INTERNAL_SERVER_ERROR.getCode(),
                HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                "An internal server error occurred.",
                INTERNAL_ERROR
            ));
        });
    }

    void handleTranslate(final Context ctx) throws TranslationException {
        final TranslateRequestDto request;
        try {
            request = ctx.bodyAsClass(TranslateRequestDto.class);
        } catch (final Exception e) {
            LOGGER.debug("Unreadable request body on {}: {}", ctx.path(), e.getMessage());
            badRequest(ctx, "Request body must be a JSON object with a 'code' field.", INVALID_REQUEST);
            return;
        }
        if (request == null || request.code() == null || request.code().isBlank()) {
            badRequest(ctx, "No code provided.", EMPTY_SOURCE);
            return;
        }

        final TranslationResult result = service.translate(request.code(), sourceName);
        ctx.status(HttpStatus.OK).json(result.sections());
    }

    void getBackends(final Context ctx) {
        final List<String> sections = new ArrayList<>();
        sections.add(TranslationResult.INTERMEDIATE_SECTION);
        sections.addAll(service.backendNames());
        ctx.status(HttpStatus.OK).json(new BackendsResponseDto(sections, service.backendNames()));
    }

    private static void badRequest(final Context ctx, final String message, final String code) {
        ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(
            HttpStatus.BAD_REQUEST.getCode(),
            HttpStatus.BAD_REQUEST.getMessage(),
            message,
            code
        ));
    }
}
