package org.silc.compiler.frontend.irgen;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.ir.IrProgram;

/**
 * Phase: lowers a syntax tree into a linear IR program by one depth-first traversal,
 * delegating each node to a converter resolved via the {@link IrConverterRegistry}.
 */
public final class IrGenerator {

	private final IrConverterRegistry registry;

	/**
	 * Creates a new IR generator with a prepared registry.
	 *
	 * @param registry The converter registry.
	 */
	public IrGenerator(IrConverterRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Generates the IR program. Either the whole tree is lowered or an exception is thrown;
	 * no partial program escapes.
	 *
	 * @param program The syntax tree.
	 * @return The generated IR program.
	 * @throws TranslationException on the first unsupported node, operator or assignment target.
	 */
	public IrProgram generate(Program program) throws TranslationException {
		IrGenContext ctx = new IrGenContext(registry);
		ctx.convert(program);
		return ctx.build();
	}
}
