package org.silc.compiler;

import org.silc.compiler.api.ITranslator;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.api.TranslationResult;
import org.silc.compiler.backend.emit.BackendRegistry;
import org.silc.compiler.backend.emit.IBackendSyntax;
import org.silc.compiler.backend.emit.StructuredEmitter;
import org.silc.compiler.diagnostics.CompilerLogger;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.frontend.irgen.IrConverterRegistry;
import org.silc.compiler.frontend.irgen.IrGenerator;
import org.silc.compiler.ir.IrPrinter;
import org.silc.compiler.ir.IrProgram;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The main translator implementation. It lowers the whole syntax tree first and only then runs
 * every configured backend over the finished instruction sequence.
 * <p>
 * All mutable state lives in per-call objects, so one instance is safe for concurrent use.
 */
public class Translator implements ITranslator {

    /** Default indentation unit of both backends. */
    public static final String DEFAULT_INDENT = "    ";

    private final IrGenerator irGenerator;
    private final StructuredEmitter emitter = new StructuredEmitter();
    private final List<IBackendSyntax> backends;

    /**
     * Creates a translator rendering Python and C++ with the default indentation.
     */
    public Translator() {
        this(BackendRegistry.initializeWithDefaults(DEFAULT_INDENT).select(List.of("python", "cpp")));
    }

    /**
     * Creates a translator rendering the given backends, in the given order.
     *
     * @param backends The backend tables.
     */
    public Translator(List<IBackendSyntax> backends) {
        this.irGenerator = new IrGenerator(IrConverterRegistry.initializeWithDefaults());
        this.backends = List.copyOf(backends);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public TranslationResult translate(Program program) throws TranslationException {
        // Phase 1: Lowering
        IrProgram ir = irGenerator.generate(program);
        String intermediate = IrPrinter.print(ir);
        CompilerLogger.debug("Translator: lowered {} statements into {} instructions", program.body().size(), ir.items().size());

        // Phase 2: Emission, one pass per backend
        Map<String, String> outputs = new LinkedHashMap<>();
        for (IBackendSyntax syntax : backends) {
            outputs.put(syntax.name(), emitter.emit(ir, syntax));
            CompilerLogger.trace("Translator: rendered backend {}", syntax.name());
        }
        CompilerLogger.debug("Translator: rendered backends {}", outputs.keySet());
        return new TranslationResult(ir, intermediate, outputs);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<String> backendNames() {
        return backends.stream().map(IBackendSyntax::name).collect(Collectors.toList());
    }
}
