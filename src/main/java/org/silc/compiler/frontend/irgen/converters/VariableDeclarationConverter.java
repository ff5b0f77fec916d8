package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.VariableDeclaration;
import org.silc.compiler.frontend.ast.VariableDeclarator;
import org.silc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;

public final class VariableDeclarationConverter implements IAstNodeToIrConverter<VariableDeclaration> {

	@Override
	public void convert(VariableDeclaration node, IrGenContext ctx) throws TranslationException {
		for (VariableDeclarator declarator : node.declarations()) {
			ctx.convert(declarator);
		}
	}
}
