package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.WhileStatement;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrCmp;
import org.silc.compiler.ir.IrJump;
import org.silc.compiler.ir.IrJumpIfFalse;
import org.silc.compiler.ir.IrLabelDef;
import org.silc.compiler.ir.IrOperand;

/**
 * Converts {@link WhileStatement}: the test is re-evaluated after the start label on every iteration.
 */
public final class WhileStatementConverter implements IAstNodeToIrConverter<WhileStatement> {

	@Override
	public void convert(WhileStatement node, IrGenContext ctx) throws TranslationException {
		String start = ctx.newLabel();
		String end = ctx.newLabel();

		ctx.emit(new IrLabelDef(start));
		IrOperand test = ctx.lower(node.test());
		ctx.emit(new IrCmp(test));
		ctx.emit(new IrJumpIfFalse(end));
		ctx.convert(node.body());
		ctx.emit(new IrJump(start));
		ctx.emit(new IrLabelDef(end));
	}
}
