package org.silc.compiler.frontend.irgen;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.Expression;
import org.silc.compiler.frontend.ast.SyntaxNode;
import org.silc.compiler.ir.IrBranch;
import org.silc.compiler.ir.IrItem;
import org.silc.compiler.ir.IrLabelDef;
import org.silc.compiler.ir.IrOperand;
import org.silc.compiler.ir.IrProgram;
import org.silc.compiler.ir.IrTemp;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable context passed to converters during one lowering run.
 * <p>
 * Holds the accumulating instruction list and two independent name counters, one for temporaries
 * ({@code t0, t1, ...}) and one for labels ({@code L0, L1, ...}). A fresh context is created per
 * translation, so concurrent translations never share state.
 */
public final class IrGenContext {

	private final IrConverterRegistry registry;
	private final List<IrItem> out = new ArrayList<>();
	private int tempCounter;
	private int labelCounter;
	private int functionDepth;

	/**
	 * Constructs a new IR generation context.
	 * @param registry The registry for resolving node converters.
	 */
	public IrGenContext(IrConverterRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Emits a new IR item.
	 * @param item The item to append to the program.
	 */
	public void emit(IrItem item) {
		out.add(item);
	}

	/**
	 * Converts a statement-like node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 * @throws TranslationException if the node or one of its children cannot be lowered.
	 */
	public void convert(SyntaxNode node) throws TranslationException {
		registry.resolve(node).convert(node, this);
	}

	/**
	 * Lowers an expression and returns the operand holding its value.
	 * @param expression The expression to lower.
	 * @return The result operand.
	 * @throws TranslationException if the expression cannot be lowered.
	 */
	public IrOperand lower(Expression expression) throws TranslationException {
		return registry.resolveExpression(expression).convert(expression, this);
	}

	/**
	 * @return A fresh temporary.
	 */
	public IrTemp newTemp() {
		return new IrTemp("t" + tempCounter++);
	}

	/**
	 * @return A fresh label name.
	 */
	public String newLabel() {
		return "L" + labelCounter++;
	}

	public void enterFunction() {
		functionDepth++;
	}

	public void exitFunction() {
		functionDepth--;
	}

	/**
	 * @return {@code true} while a function body is being lowered.
	 */
	public boolean insideFunction() {
		return functionDepth > 0;
	}

	/**
	 * Builds the final {@link IrProgram} from the emitted items after checking that every branch
	 * target is defined exactly once.
	 * @return The constructed program.
	 * @throws TranslationException if a label is referenced but never defined, or defined twice.
	 */
	public IrProgram build() throws TranslationException {
		Map<String, Integer> definitions = new HashMap<>();
		Set<String> referenced = new LinkedHashSet<>();
		for (IrItem item : out) {
			if (item instanceof IrLabelDef def) {
				definitions.merge(def.name(), 1, Integer::sum);
			} else if (item instanceof IrBranch branch) {
				referenced.add(branch.label());
			}
		}
		for (Map.Entry<String, Integer> def : definitions.entrySet()) {
			if (def.getValue() > 1) {
				throw TranslationException.malformedControlFlow(def.getKey(), "label defined " + def.getValue() + " times");
			}
		}
		for (String label : referenced) {
			if (!definitions.containsKey(label)) {
				throw TranslationException.malformedControlFlow(label, "branch target is never defined");
			}
		}
		return new IrProgram(out);
	}
}
