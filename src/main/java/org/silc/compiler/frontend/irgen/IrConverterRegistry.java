package org.silc.compiler.frontend.irgen;

import org.silc.compiler.frontend.ast.AssignmentExpression;
import org.silc.compiler.frontend.ast.BinaryExpression;
import org.silc.compiler.frontend.ast.BlockStatement;
import org.silc.compiler.frontend.ast.Expression;
import org.silc.compiler.frontend.ast.ExpressionStatement;
import org.silc.compiler.frontend.ast.ForStatement;
import org.silc.compiler.frontend.ast.FunctionDeclaration;
import org.silc.compiler.frontend.ast.Identifier;
import org.silc.compiler.frontend.ast.IfStatement;
import org.silc.compiler.frontend.ast.Literal;
import org.silc.compiler.frontend.ast.LogicalExpression;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.frontend.ast.ReturnStatement;
import org.silc.compiler.frontend.ast.SyntaxNode;
import org.silc.compiler.frontend.ast.VariableDeclaration;
import org.silc.compiler.frontend.ast.VariableDeclarator;
import org.silc.compiler.frontend.ast.WhileStatement;
import org.silc.compiler.frontend.irgen.converters.AssignmentExpressionConverter;
import org.silc.compiler.frontend.irgen.converters.BinaryExpressionConverter;
import org.silc.compiler.frontend.irgen.converters.BlockStatementConverter;
import org.silc.compiler.frontend.irgen.converters.ExpressionStatementConverter;
import org.silc.compiler.frontend.irgen.converters.ForStatementConverter;
import org.silc.compiler.frontend.irgen.converters.FunctionDeclarationConverter;
import org.silc.compiler.frontend.irgen.converters.IdentifierConverter;
import org.silc.compiler.frontend.irgen.converters.IfStatementConverter;
import org.silc.compiler.frontend.irgen.converters.LiteralConverter;
import org.silc.compiler.frontend.irgen.converters.LogicalExpressionConverter;
import org.silc.compiler.frontend.irgen.converters.ProgramConverter;
import org.silc.compiler.frontend.irgen.converters.ReturnStatementConverter;
import org.silc.compiler.frontend.irgen.converters.VariableDeclarationConverter;
import org.silc.compiler.frontend.irgen.converters.VariableDeclaratorConverter;
import org.silc.compiler.frontend.irgen.converters.WhileStatementConverter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping syntax node classes to converter instances.
 * <p>
 * Statement-like nodes and expressions are kept in separate tables because expression converters
 * yield an operand. Node types are records, so lookup is by exact class. Unregistered types
 * resolve to the fallback, which rejects them.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends SyntaxNode>, IAstNodeToIrConverter<? extends SyntaxNode>> nodeConverters = new HashMap<>();
	private final Map<Class<? extends Expression>, IExpressionToIrConverter<? extends Expression>> expressionConverters = new HashMap<>();
	private final UnsupportedNodeConverter fallback;

	private IrConverterRegistry(UnsupportedNodeConverter fallback) {
		this.fallback = fallback;
	}

	/**
	 * Registers a converter for a statement-like node class.
	 *
	 * @param nodeType  The node class.
	 * @param converter The converter handling that class.
	 * @param <T>       Concrete node type.
	 */
	public <T extends SyntaxNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		nodeConverters.put(nodeType, converter);
	}

	/**
	 * Registers a converter for an expression class.
	 *
	 * @param nodeType  The expression class.
	 * @param converter The converter handling that class.
	 * @param <T>       Concrete expression type.
	 */
	public <T extends Expression> void register(Class<T> nodeType, IExpressionToIrConverter<T> converter) {
		expressionConverters.put(nodeType, converter);
	}

	/**
	 * Retrieves the statement converter registered for the given class, if any.
	 *
	 * @param nodeType The node class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IAstNodeToIrConverter<? extends SyntaxNode>> get(Class<? extends SyntaxNode> nodeType) {
		return Optional.ofNullable(nodeConverters.get(nodeType));
	}

	/**
	 * Retrieves the expression converter registered for the given class, if any.
	 *
	 * @param nodeType The expression class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IExpressionToIrConverter<? extends Expression>> getExpression(Class<? extends Expression> nodeType) {
		return Optional.ofNullable(expressionConverters.get(nodeType));
	}

	/**
	 * Resolves the converter for a statement-like node.
	 *
	 * @param node The node.
	 * @return A non-null converter; the fallback if none is registered.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<SyntaxNode> resolve(SyntaxNode node) {
		IAstNodeToIrConverter<?> found = nodeConverters.get(node.getClass());
		return found != null ? (IAstNodeToIrConverter<SyntaxNode>) found : fallback;
	}

	/**
	 * Resolves the converter for an expression.
	 *
	 * @param node The expression.
	 * @return A non-null converter; the fallback if none is registered.
	 */
	@SuppressWarnings("unchecked")
	public IExpressionToIrConverter<Expression> resolveExpression(Expression node) {
		IExpressionToIrConverter<?> found = expressionConverters.get(node.getClass());
		return found != null ? (IExpressionToIrConverter<Expression>) found : fallback;
	}

	/**
	 * Creates an empty registry. Converters are registered by the caller.
	 *
	 * @return A new registry instance.
	 */
	public static IrConverterRegistry initialize() {
		return new IrConverterRegistry(new UnsupportedNodeConverter());
	}

	/**
	 * Creates a registry with a converter for every supported node kind.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize();
		reg.register(Program.class, new ProgramConverter());
		reg.register(VariableDeclaration.class, new VariableDeclarationConverter());
		reg.register(VariableDeclarator.class, new VariableDeclaratorConverter());
		reg.register(ExpressionStatement.class, new ExpressionStatementConverter());
		reg.register(BlockStatement.class, new BlockStatementConverter());
		reg.register(IfStatement.class, new IfStatementConverter());
		reg.register(WhileStatement.class, new WhileStatementConverter());
		reg.register(ForStatement.class, new ForStatementConverter());
		reg.register(FunctionDeclaration.class, new FunctionDeclarationConverter());
		reg.register(ReturnStatement.class, new ReturnStatementConverter());

		reg.register(Literal.class, new LiteralConverter());
		reg.register(Identifier.class, new IdentifierConverter());
		reg.register(BinaryExpression.class, new BinaryExpressionConverter());
		reg.register(LogicalExpression.class, new LogicalExpressionConverter());
		reg.register(AssignmentExpression.class, new AssignmentExpressionConverter());
		return reg;
	}
}
