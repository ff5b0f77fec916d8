package org.silc.compiler.frontend.irgen.converters;

import org.silc.compiler.frontend.ast.Literal;
import org.silc.compiler.frontend.irgen.IExpressionToIrConverter;
import org.silc.compiler.frontend.irgen.IrGenContext;
import org.silc.compiler.ir.IrLiteral;
import org.silc.compiler.ir.IrOperand;

public final class LiteralConverter implements IExpressionToIrConverter<Literal> {

	@Override
	public IrOperand convert(Literal node, IrGenContext ctx) {
		return new IrLiteral(IrLiteral.Type.valueOf(node.type().name()), node.value());
	}
}
