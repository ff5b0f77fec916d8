package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.BlockStatement;
import org.silc.compiler.frontend.ast.Statement;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;

public final class BlockStatementConverter implements IAstNodeToIrConverter<BlockStatement> {

	@Override
	public void convert(BlockStatement node, IrGenContext ctx) throws TranslationException {
		for (Statement statement : node.body()) {
			ctx.convert(statement);
		}
	}
}
