package org.silc.server.http;

import com.typesafe.config.Config;
import org.silc.service.TranslationService;

/**
 * An abstract base class for {@link IController} implementations. Every controller gets the
 * shared {@link TranslationService} and its own configuration block.
 */
public abstract class AbstractController implements IController {

    protected final TranslationService service;
    protected final Config options;

    /**
     * @param service The translation service shared by all controllers.
     * @param options The HOCON configuration specific to this controller instance.
     */
    public AbstractController(final TranslationService service, final Config options) {
        this.service = service;
        this.options = options;
    }
}
