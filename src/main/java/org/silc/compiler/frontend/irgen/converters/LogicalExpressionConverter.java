package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.LogicalExpression;
import org.silc.compiler.frontend.irgen.IExpressionToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrCmp;
import org.silc.compiler.ir.IrConditionalBranch;
import org.silc.compiler.ir.IrJump;
import org.silc.compiler.ir.IrJumpIfFalse;
import org.silc.compiler.ir.IrJumpIfTrue;
import org.silc.compiler.ir.IrLabelDef;
import org.silc.compiler.ir.IrMov;
import org.silc.compiler.ir.IrOperand;
import org.silc.compiler.ir.IrTemp;

/**
 * Converts {@code &&} and {@code ||} into short-circuit control flow:
 * <pre>
 *   cmp left
 *   jmp_if_false sc      (jmp_if_true for ||)
 *   ...right...
 *   mov result, right
 *   jmp end
 * sc:
 *   mov result, left
 * end:
 * </pre>
 * The right operand's instructions sit only on the fall-through path.
 */
public final class LogicalExpressionConverter implements IExpressionToIrConverter<LogicalExpression> {

	@Override
	public IrOperand convert(LogicalExpression node, IrGenContext ctx) throws TranslationException {
		IrOperand left = ctx.lower(node.left());
		IrTemp result = ctx.newTemp();
		String shortCircuit = ctx.newLabel();
		String end = ctx.newLabel();

		IrConditionalBranch skipRight = switch (node.operator()) {
			case "&&" -> new IrJumpIfFalse(shortCircuit);
			case "||" -> new IrJumpIfTrue(shortCircuit);
			default -> throw TranslationException.unsupportedOperator(node.operator(), node.kind());
		};

		ctx.emit(new IrCmp(left));
		ctx.emit(skipRight);
		IrOperand right = ctx.lower(node.right());
		ctx.emit(new IrMov(result, right));
		ctx.emit(new IrJump(end));
		ctx.emit(new IrLabelDef(shortCircuit));
		ctx.emit(new IrMov(result, left));
		ctx.emit(new IrLabelDef(end));
		return result;
	}
}
