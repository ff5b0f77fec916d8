package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.frontend.ast.Statement;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;

/**
 * Converts the top-level statements in order. Contributes no instructions itself.
 */
public final class ProgramConverter implements IAstNodeToIrConverter<Program> {

	@Override
	public void convert(Program node, IrGenContext ctx) throws TranslationException {
		for (Statement statement : node.body()) {
			ctx.convert(statement);
		}
	}
}
