package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.IfStatement;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrCmp;
import org.silc.compiler.ir.IrJump;
import org.silc.compiler.ir.IrJumpIfFalse;
import org.silc.compiler.ir.IrLabelDef;
import org.silc.compiler.ir.IrOperand;

/**
 * Converts {@link IfStatement}. Without an else branch only one label is allocated.
 */
public final class IfStatementConverter implements IAstNodeToIrConverter<IfStatement> {

	@Override
	public void convert(IfStatement node, IrGenContext ctx) throws TranslationException {
		IrOperand condition = ctx.lower(node.test());
		String elseLabel = ctx.newLabel();
		String endLabel = node.alternate() != null ? ctx.newLabel() : null;

		ctx.emit(new IrCmp(condition));
		ctx.emit(new IrJumpIfFalse(elseLabel));
		ctx.convert(node.consequent());
		if (node.alternate() != null) {
			ctx.emit(new IrJump(endLabel));
			ctx.emit(new IrLabelDef(elseLabel));
			ctx.convert(node.alternate());
			ctx.emit(new IrLabelDef(endLabel));
		} else {
			ctx.emit(new IrLabelDef(elseLabel));
		}
	}
}
