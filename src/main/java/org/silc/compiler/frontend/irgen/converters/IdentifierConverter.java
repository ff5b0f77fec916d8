package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.frontend.ast.Identifier;
import org.silc.compiler.frontend.irgen.IExpressionToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrOperand;
import org.silc.compiler.ir.IrVar;

public final class IdentifierConverter implements IExpressionToIrConverter<Identifier> {

	@Override
	public IrOperand convert(Identifier node, IrGenContext ctx) {
		return new IrVar(node.name());
	}
}
