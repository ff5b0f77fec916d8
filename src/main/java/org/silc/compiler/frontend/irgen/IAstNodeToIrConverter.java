package org.silc.compiler.frontend.irgen;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.SyntaxNode;

/**
 * Converts a specific statement-like node type into zero or more IR items.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link IrGenContext}.
 *
 * @param <T> The concrete node type handled by this converter.
 */
public interface IAstNodeToIrConverter<T extends SyntaxNode> {

	/**
	 * Converts the given node into IR and emits results via the provided context.
	 *
	 * @param node The node to convert.
	 * @param ctx  The IR generation context used to emit IR items and allocate names.
	 * @throws TranslationException if the node cannot be lowered.
	 */
	void convert(T node, IrGenContext ctx) throws TranslationException;
}
