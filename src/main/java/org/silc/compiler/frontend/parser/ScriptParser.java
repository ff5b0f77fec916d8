package org.silc.compiler.frontend.parser;

import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Block;
import org.mozilla.javascript.ast.EmptyExpression;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.ForLoop;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.InfixExpression;
import org.mozilla.javascript.ast.KeywordLiteral;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NumberLiteral;
import org.mozilla.javascript.ast.ParenthesizedExpression;
import org.mozilla.javascript.ast.Scope;
import org.mozilla.javascript.ast.StringLiteral;
import org.mozilla.javascript.ast.VariableInitializer;
import org.mozilla.javascript.ast.WhileLoop;
import org.silc.compiler.api.TranslationErrorCode;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.AssignmentExpression;
import org.silc.compiler.frontend.ast.BinaryExpression;
import org.silc.compiler.frontend.ast.BlockStatement;
import org.silc.compiler.frontend.ast.Expression;
import org.silc.compiler.frontend.ast.ForStatement;
import org.silc.compiler.frontend.ast.FunctionDeclaration;
import org.silc.compiler.frontend.ast.Identifier;
import org.silc.compiler.frontend.ast.IfStatement;
import org.silc.compiler.frontend.ast.Literal;
import org.silc.compiler.frontend.ast.LogicalExpression;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.frontend.ast.ReturnStatement;
import org.silc.compiler.frontend.ast.Statement;
import org.silc.compiler.frontend.ast.SyntaxNode;
import org.silc.compiler.frontend.ast.UnsupportedNode;
import org.silc.compiler.frontend.ast.VariableDeclaration;
import org.silc.compiler.frontend.ast.VariableDeclarator;
import org.silc.compiler.frontend.ast.WhileStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses source text with the Mozilla Rhino parser and maps Rhino's AST onto the translator's
 * closed {@link SyntaxNode} model.
 * <p>
 * Only syntax errors fail here. Constructs outside the supported grammar are mapped to
 * {@link UnsupportedNode} carrying Rhino's node class name, so lowering can reject them with
 * a precise kind. Nothing is dropped silently.
 * <p>
 * Instances are immutable; every call uses a fresh Rhino {@link Parser}.
 */
public class ScriptParser {

    private static final Logger log = LoggerFactory.getLogger(ScriptParser.class);

    /** Rhino's ES6 language level. */
    public static final int DEFAULT_LANGUAGE_VERSION = 200;

    private final int languageVersion;

    public ScriptParser() {
        this(DEFAULT_LANGUAGE_VERSION);
    }

    /**
     * @param languageVersion The Rhino language version, e.g. 200 for ES6.
     */
    public ScriptParser(int languageVersion) {
        this.languageVersion = languageVersion;
    }

    /**
     * Parses the source text into a syntax tree.
     *
     * @param source     The source text.
     * @param sourceName The name used in parser messages.
     * @return The syntax tree.
     * @throws TranslationException with {@link TranslationErrorCode#SYNTAX_ERROR} if the text does not parse.
     */
    public Program parse(String source, String sourceName) throws TranslationException {
        CompilerEnvirons env = new CompilerEnvirons();
        env.setLanguageVersion(languageVersion);
        env.setRecordingComments(false);
        AstRoot root;
        try {
            root = new Parser(env).parse(source, sourceName, 1);
        } catch (RhinoException e) {
            log.debug("Rhino rejected {} at line {}: {}", sourceName, e.lineNumber(), e.details());
            throw new TranslationException(TranslationErrorCode.SYNTAX_ERROR, sourceName,
                    "Syntax error at line " + e.lineNumber() + ": " + e.details(), e);
        }
        return new Program(statements(root));
    }

    public Program parse(String source) throws TranslationException {
        return parse(source, "<input>");
    }

    private List<Statement> statements(AstNode container) {
        List<Statement> body = new ArrayList<>();
        for (Node kid : container) {
            body.add(statement((AstNode) kid));
        }
        return body;
    }

    private Statement statement(AstNode node) {
        if (node instanceof org.mozilla.javascript.ast.VariableDeclaration v) {
            return variables(v);
        }
        if (node instanceof FunctionNode fn) {
            return function(fn);
        }
        if (node instanceof ExpressionStatement es) {
            AstNode inner = es.getExpression();
            // Rhino wraps some declarations in an expression statement
            if (inner instanceof FunctionNode || inner instanceof org.mozilla.javascript.ast.VariableDeclaration) {
                return statement(inner);
            }
            return new org.silc.compiler.frontend.ast.ExpressionStatement(expression(inner));
        }
        if (node instanceof org.mozilla.javascript.ast.IfStatement is) {
            AstNode elsePart = is.getElsePart();
            return new IfStatement(expression(is.getCondition()), statement(is.getThenPart()),
                    elsePart == null ? null : statement(elsePart));
        }
        if (node instanceof WhileLoop loop) {
            return new WhileStatement(expression(loop.getCondition()), statement(loop.getBody()));
        }
        if (node instanceof ForLoop loop) {
            return forLoop(loop);
        }
        if (node instanceof org.mozilla.javascript.ast.ReturnStatement rs) {
            AstNode value = rs.getReturnValue();
            return new ReturnStatement(value == null ? null : expression(value));
        }
        // ForLoop, FunctionNode and friends are Scope subclasses too, so only plain blocks get here
        if (node instanceof Block || node.getClass() == Scope.class) {
            return new BlockStatement(statements(node));
        }
        return unsupported(node);
    }

    private Statement variables(org.mozilla.javascript.ast.VariableDeclaration node) {
        List<VariableDeclarator> declarators = new ArrayList<>();
        for (VariableInitializer init : node.getVariables()) {
            if (!(init.getTarget() instanceof Name name)) {
                return new UnsupportedNode("DestructuringDeclaration");
            }
            AstNode value = init.getInitializer();
            declarators.add(new VariableDeclarator(name.getIdentifier(), value == null ? null : expression(value)));
        }
        return new VariableDeclaration(declarators);
    }

    private Statement function(FunctionNode fn) {
        int type = fn.getFunctionType();
        if (fn.getFunctionName() == null
                || (type != FunctionNode.FUNCTION_STATEMENT && type != FunctionNode.FUNCTION_EXPRESSION_STATEMENT)) {
            return new UnsupportedNode("FunctionExpression");
        }
        List<String> params = new ArrayList<>();
        for (AstNode param : fn.getParams()) {
            if (!(param instanceof Name name)) {
                return new UnsupportedNode("ComplexParameter");
            }
            params.add(name.getIdentifier());
        }
        return new FunctionDeclaration(fn.getName(), params, new BlockStatement(statements(fn.getBody())));
    }

    private Statement forLoop(ForLoop loop) {
        AstNode init = loop.getInitializer();
        SyntaxNode initNode = null;
        if (init instanceof org.mozilla.javascript.ast.VariableDeclaration v) {
            initNode = variables(v);
        } else if (!isEmpty(init)) {
            initNode = expression(init);
        }
        Expression test = isEmpty(loop.getCondition()) ? null : expression(loop.getCondition());
        Expression update = isEmpty(loop.getIncrement()) ? null : expression(loop.getIncrement());
        return new ForStatement(initNode, test, update, statement(loop.getBody()));
    }

    private Expression expression(AstNode node) {
        while (node instanceof ParenthesizedExpression p) {
            node = p.getExpression();
        }
        if (node instanceof Name name) {
            return new Identifier(name.getIdentifier());
        }
        if (node instanceof NumberLiteral number) {
            return Literal.number(number.getValue());
        }
        if (node instanceof StringLiteral string) {
            return Literal.string(string.getValue());
        }
        if (node instanceof KeywordLiteral keyword) {
            switch (keyword.getType()) {
                case Token.TRUE:
                    return Literal.bool(true);
                case Token.FALSE:
                    return Literal.bool(false);
                case Token.NULL:
                    return new Literal(Literal.Type.NULL, "null");
                default:
                    return unsupported(node);
            }
        }
        // Assignment is an InfixExpression subclass
        if (node instanceof Assignment assignment) {
            return new AssignmentExpression(AstNode.operatorToString(assignment.getType()),
                    expression(assignment.getLeft()), expression(assignment.getRight()));
        }
        if (node instanceof InfixExpression infix && isBinaryOperator(infix.getType())) {
            String operator = AstNode.operatorToString(infix.getType());
            Expression left = expression(infix.getLeft());
            Expression right = expression(infix.getRight());
            if (infix.getType() == Token.AND || infix.getType() == Token.OR) {
                return new LogicalExpression(operator, left, right);
            }
            return new BinaryExpression(operator, left, right);
        }
        return unsupported(node);
    }

    private static boolean isBinaryOperator(int tokenType) {
        switch (tokenType) {
            case Token.ADD:
            case Token.SUB:
            case Token.MUL:
            case Token.DIV:
            case Token.MOD:
            case Token.BITOR:
            case Token.BITXOR:
            case Token.BITAND:
            case Token.LSH:
            case Token.RSH:
            case Token.URSH:
            case Token.EQ:
            case Token.NE:
            case Token.SHEQ:
            case Token.SHNE:
            case Token.LT:
            case Token.LE:
            case Token.GT:
            case Token.GE:
            case Token.AND:
            case Token.OR:
                return true;
            default:
                // comma, property access, in, instanceof
                return false;
        }
    }

    private static boolean isEmpty(AstNode node) {
        return node == null || node instanceof EmptyExpression;
    }

    private static UnsupportedNode unsupported(AstNode node) {
        return new UnsupportedNode(node.getClass().getSimpleName());
    }
}
