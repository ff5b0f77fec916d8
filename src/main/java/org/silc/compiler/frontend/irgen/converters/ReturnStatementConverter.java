package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.ReturnStatement;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrReturn;

public final class ReturnStatementConverter implements IAstNodeToIrConverter<ReturnStatement> {

	@Override
	public void convert(ReturnStatement node, IrGenContext ctx) throws TranslationException {
		if (node.argument() == null) {
			ctx.emit(new IrReturn(null));
		} else {
			ctx.emit(new IrReturn(ctx.lower(node.argument())));
		}
	}
}
