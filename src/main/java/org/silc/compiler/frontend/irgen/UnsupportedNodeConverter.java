package org.silc.compiler.frontend.irgen;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.Expression;
import org.silc.compiler.frontend.ast.SyntaxNode;
import org.silc.compiler.ir.IrOperand;

/**
 * Fallback used for every node kind without a registered converter. Lowering is all-or-nothing,
 * so it rejects the node instead of skipping it.
 */
public final class UnsupportedNodeConverter
		implements IAstNodeToIrConverter<SyntaxNode>, IExpressionToIrConverter<Expression> {

	@Override
	public void convert(SyntaxNode node, IrGenContext ctx) throws TranslationException {
		throw TranslationException.unsupportedConstruct(node.kind());
	}

	@Override
	public IrOperand convert(Expression node, IrGenContext ctx) throws TranslationException {
		throw TranslationException.unsupportedConstruct(node.kind());
	}
}
