package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.Expression;
import org.silc.compiler.frontend.ast.ForStatement;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrCmp;
import org.silc.compiler.ir.IrJump;
import org.silc.compiler.ir.IrJumpIfFalse;
import org.silc.compiler.ir.IrLabelDef;
import org.silc.compiler.ir.IrOperand;

/**
 * Converts {@link ForStatement} into the while-loop shape. The init clause runs once before the
 * start label and the update clause sits just before the back edge. Without a test clause the
 * loop is unconditional and no compare is emitted.
 */
public final class ForStatementConverter implements IAstNodeToIrConverter<ForStatement> {

	@Override
	public void convert(ForStatement node, IrGenContext ctx) throws TranslationException {
		if (node.init() instanceof Expression init) {
			ctx.lower(init);
		} else if (node.init() != null) {
			ctx.convert(node.init());
		}
		String start = ctx.newLabel();
		String end = ctx.newLabel();

		ctx.emit(new IrLabelDef(start));
		if (node.test() != null) {
			IrOperand test = ctx.lower(node.test());
			ctx.emit(new IrCmp(test));
			ctx.emit(new IrJumpIfFalse(end));
		}
		ctx.convert(node.body());
		if (node.update() != null) {
			ctx.lower(node.update());
		}
		ctx.emit(new IrJump(start));
		ctx.emit(new IrLabelDef(end));
	}
}
