package org.silc.compiler.frontend.irgen;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.Expression;
import org.silc.compiler.ir.IrOperand;

/**
 * Converts a specific expression type into IR and yields the operand holding its value.
 * Side-effect-free expressions emit nothing and return their operand directly.
 *
 * @param <T> The concrete expression type handled by this converter.
 */
public interface IExpressionToIrConverter<T extends Expression> {

	/**
	 * Lowers the expression.
	 *
	 * @param node The expression to lower.
	 * @param ctx  The IR generation context.
	 * @return The operand that holds the expression's value.
	 * @throws TranslationException if the expression cannot be lowered.
	 */
	IrOperand convert(T node, IrGenContext ctx) throws TranslationException;
}
