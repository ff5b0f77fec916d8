package org.silc.compiler.ir;

import java.util.stream.Collectors;

/**
 * Renders IR in its textual three-address form, one instruction per line.
 */
public final class IrPrinter {

	private IrPrinter() {}

	/**
	 * Renders a whole program.
	 * @param program The program to render.
	 * @return The instructions joined by newlines, without a trailing newline.
	 */
	public static String print(IrProgram program) {
		return program.items().stream().map(IrPrinter::format).collect(Collectors.joining("\n"));
	}

	/**
	 * Renders a single instruction, e.g. {@code add t0, a, b} or {@code L1:}.
	 * @param item The instruction.
	 * @return Its textual form.
	 */
	public static String format(IrItem item) {
		if (item instanceof IrDecl d) return "decl " + d.name();
		if (item instanceof IrMov m) return "mov " + m.dest().text() + ", " + m.source().text();
		if (item instanceof IrArith a) return threeAddress(a.op().mnemonic(), a.dest(), a.lhs(), a.rhs());
		if (item instanceof IrCompare c) return threeAddress(c.op().mnemonic(), c.dest(), c.lhs(), c.rhs());
		if (item instanceof IrCmp c) return "cmp " + c.operand().text();
		if (item instanceof IrJumpIfFalse j) return "jmp_if_false " + j.label();
		if (item instanceof IrJumpIfTrue j) return "jmp_if_true " + j.label();
		if (item instanceof IrJump j) return "jmp " + j.label();
		if (item instanceof IrLabelDef l) return l.name() + ":";
		if (item instanceof IrFuncBegin f) return "func " + f.name();
		if (item instanceof IrParam p) return "param " + p.name();
		if (item instanceof IrFuncEnd) return "endfunc";
		if (item instanceof IrReturn r) return r.hasOperand() ? "ret " + r.operand().text() : "ret";
		throw new IllegalArgumentException("Unknown IR item: " + item);
	}

	private static String threeAddress(String mnemonic, IrOperand dest, IrOperand lhs, IrOperand rhs) {
		return mnemonic + " " + dest.text() + ", " + lhs.text() + ", " + rhs.text();
	}
}
