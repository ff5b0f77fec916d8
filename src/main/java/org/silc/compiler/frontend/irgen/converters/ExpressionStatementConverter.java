package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.ExpressionStatement;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;

/**
 * Lowers the wrapped expression for its effects and discards the result operand.
 */
public final class ExpressionStatementConverter implements IAstNodeToIrConverter<ExpressionStatement> {

	@Override
	public void convert(ExpressionStatement node, IrGenContext ctx) throws TranslationException {
		ctx.lower(node.expression());
	}
}
