package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.BinaryExpression;
import org.silc.compiler.frontend.irgen.IExpressionToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.ArithmeticOp;
import org.silc.compiler.ir.CompareOp;
import org.silc.compiler.ir.IrArith;
import org.silc.compiler.ir.IrCompare;
import org.silc.compiler.ir.IrOperand;
import org.silc.compiler.ir.IrTemp;

import java.util.Optional;

/**
 * Converts {@link BinaryExpression} into a single arithmetic or compare instruction writing a fresh temporary.
 * <p>
 * Operands are always lowered left before right.
 */
public final class BinaryExpressionConverter implements IExpressionToIrConverter<BinaryExpression> {

	@Override
	public IrOperand convert(BinaryExpression node, IrGenContext ctx) throws TranslationException {
		IrOperand left = ctx.lower(node.left());
		IrOperand right = ctx.lower(node.right());

		Optional<ArithmeticOp> arithmetic = ArithmeticOp.fromSymbol(node.operator());
		if (arithmetic.isPresent()) {
			IrTemp result = ctx.newTemp();
			ctx.emit(new IrArith(arithmetic.get(), result, left, right));
			return result;
		}
		Optional<CompareOp> compare = CompareOp.fromSymbol(node.operator());
		if (compare.isPresent()) {
			IrTemp result = ctx.newTemp();
			ctx.emit(new IrCompare(compare.get(), result, left, right));
			return result;
		}
		throw TranslationException.unsupportedOperator(node.operator(), node.kind());
	}
}
