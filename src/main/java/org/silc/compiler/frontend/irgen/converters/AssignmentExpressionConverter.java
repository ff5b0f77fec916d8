package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.AssignmentExpression;
import org.silc.compiler.frontend.ast.Identifier;
import org.silc.compiler.frontend.irgen.IExpressionToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrMov;
import org.silc.compiler.ir.IrOperand;
import org.silc.compiler.ir.IrVar;

/**
 * Converts a plain assignment into {@code mov target, value}. The expression's value is the target variable.
 */
public final class AssignmentExpressionConverter implements IExpressionToIrConverter<AssignmentExpression> {

	@Override
	public IrOperand convert(AssignmentExpression node, IrGenContext ctx) throws TranslationException {
		if (!"=".equals(node.operator())) {
			throw TranslationException.unsupportedOperator(node.operator(), node.kind());
		}
		IrOperand value = ctx.lower(node.value());
		if (!(node.target() instanceof Identifier id)) {
			throw TranslationException.invalidAssignmentTarget(node.target().kind());
		}
		IrVar target = new IrVar(id.name());
		ctx.emit(new IrMov(target, value));
		return target;
	}
}
