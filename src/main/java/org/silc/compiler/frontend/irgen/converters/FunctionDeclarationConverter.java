package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationErrorCode;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.FunctionDeclaration;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrFuncBegin;
import org.silc.compiler.ir.IrFuncEnd;
import org.silc.compiler.ir.IrParam;

/**
 * Converts {@link FunctionDeclaration} into {@code func}, one {@code param} per formal in
 * declaration order, the body, and {@code endfunc}. Functions may only be declared at top level.
 */
public final class FunctionDeclarationConverter implements IAstNodeToIrConverter<FunctionDeclaration> {

	@Override
	public void convert(FunctionDeclaration node, IrGenContext ctx) throws TranslationException {
		if (ctx.insideFunction()) {
			throw new TranslationException(TranslationErrorCode.UNSUPPORTED_CONSTRUCT, node.kind(),
					"Unsupported construct: nested " + node.kind() + " '" + node.name() + "'");
		}
		ctx.enterFunction();
		ctx.emit(new IrFuncBegin(node.name()));
		for (String parameter : node.parameters()) {
			ctx.emit(new IrParam(parameter));
		}
		ctx.convert(node.body());
		ctx.emit(new IrFuncEnd());
		ctx.exitFunction();
	}
}
