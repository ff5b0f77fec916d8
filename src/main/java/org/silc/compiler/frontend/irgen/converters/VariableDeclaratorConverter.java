package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.VariableDeclarator;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrDecl;
import org.silc.compiler.ir.IrMov;
import org.silc.compiler.ir.IrOperand;
import org.silc.compiler.ir.IrVar;

/**
 * Converts a declarator into {@code decl name}, followed by {@code mov name, value} when it has an initializer.
 */
public final class VariableDeclaratorConverter implements IAstNodeToIrConverter<VariableDeclarator> {

	@Override
	public void convert(VariableDeclarator node, IrGenContext ctx) throws TranslationException {
		ctx.emit(new IrDecl(node.name()));
		if (node.initializer() != null) {
			IrOperand value = ctx.lower(node.initializer());
			ctx.emit(new IrMov(new IrVar(node.name()), value));
		}
	}
}
