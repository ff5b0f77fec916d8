package org.silc.compiler.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silc.compiler.api.TranslationErrorCode;
import org.silc.compiler.api.TranslationException;
import org.silc.compiler.frontend.ast.AssignmentExpression;
import org.silc.compiler.frontend.ast.BinaryExpression;
import org.silc.compiler.frontend.ast.BlockStatement;
import org.silc.compiler.frontend.ast.ExpressionStatement;
import org.silc.compiler.frontend.ast.ForStatement;
import org.silc.compiler.frontend.ast.FunctionDeclaration;
import org.silc.compiler.frontend.ast.Identifier;
import org.silc.compiler.frontend.ast.IfStatement;
import org.silc.compiler.frontend.ast.Literal;
import org.silc.compiler.frontend.ast.LogicalExpression;
import org.silc.compiler.frontend.ast.Program;
import org.silc.compiler.frontend.ast.ReturnStatement;
import org.silc.compiler.frontend.ast.Statement;
import org.silc.compiler.frontend.ast.UnsupportedNode;
import org.silc.compiler.frontend.ast.VariableDeclaration;
import org.silc.compiler.frontend.ast.VariableDeclarator;
import org.silc.compiler.frontend.ast.WhileStatement;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScriptParserTest {

    private final ScriptParser parser = new ScriptParser();

    private Statement single(String source) throws TranslationException {
        Program program = parser.parse(source);
        assertThat(program.body()).hasSize(1);
        return program.body().get(0);
    }

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    @Test
    @Tag("unit")
    void mapsDeclarationsWithOptionalInitializers() throws Exception {
        assertThat(single("var a = 1, b;")).isEqualTo(new VariableDeclaration(List.of(
                new VariableDeclarator("a", Literal.number("1")),
                new VariableDeclarator("b", null))));
        assertThat(single("let s = \"hi\";")).isEqualTo(new VariableDeclaration(List.of(
                new VariableDeclarator("s", Literal.string("hi")))));
    }

    @Test
    @Tag("unit")
    void keepsOperatorPrecedenceAndDropsParentheses() throws Exception {
        assertThat(single("x = (a + b) * c;")).isEqualTo(new ExpressionStatement(AssignmentExpression.assign(id("x"),
                new BinaryExpression("*", new BinaryExpression("+", id("a"), id("b")), id("c")))));
    }

    @Test
    @Tag("unit")
    void mapsLogicalOperatorsSeparatelyFromBinaryOnes() throws Exception {
        assertThat(single("x = a && b || c;")).isEqualTo(new ExpressionStatement(AssignmentExpression.assign(id("x"),
                new LogicalExpression("||", new LogicalExpression("&&", id("a"), id("b")), id("c")))));
    }

    @Test
    @Tag("unit")
    void mapsKeywordLiterals() throws Exception {
        Program program = parser.parse("a = true; b = false; c = null;");

        assertThat(program.body()).extracting(s -> ((AssignmentExpression) ((ExpressionStatement) s).expression()).value())
                .containsExactly(Literal.bool(true), Literal.bool(false), new Literal(Literal.Type.NULL, "null"));
    }

    @Test
    @Tag("unit")
    void keepsCompoundAndChainedAssignments() throws Exception {
        assertThat(single("a += 1;")).isEqualTo(new ExpressionStatement(
                new AssignmentExpression("+=", id("a"), Literal.number("1"))));
        assertThat(single("a = b = 2;")).isEqualTo(new ExpressionStatement(AssignmentExpression.assign(id("a"),
                AssignmentExpression.assign(id("b"), Literal.number("2")))));
    }

    @Test
    @Tag("unit")
    void mapsIfElseAndWhile() throws Exception {
        Statement ifElse = single("if (a < b) { a = 1; } else a = 2;");

        assertThat(ifElse).isInstanceOf(IfStatement.class);
        IfStatement stmt = (IfStatement) ifElse;
        assertThat(stmt.test()).isEqualTo(new BinaryExpression("<", id("a"), id("b")));
        assertThat(stmt.consequent()).isInstanceOf(BlockStatement.class);
        assertThat(stmt.alternate()).isInstanceOf(ExpressionStatement.class);

        Statement loop = single("while (a) { }");
        assertThat(loop).isEqualTo(new WhileStatement(id("a"), new BlockStatement(List.of())));
    }

    @Test
    @Tag("unit")
    void mapsForWithAndWithoutClauses() throws Exception {
        ForStatement full = (ForStatement) single("for (var i = 0; i < 3; i = i + 1) { s = s + i; }");
        assertThat(full.init()).isInstanceOf(VariableDeclaration.class);
        assertThat(full.test()).isEqualTo(new BinaryExpression("<", id("i"), Literal.number("3")));
        assertThat(full.update()).isInstanceOf(AssignmentExpression.class);

        assertThat(single("for (;;) {}")).isEqualTo(new ForStatement(null, null, null, new BlockStatement(List.of())));
    }

    @Test
    @Tag("unit")
    void mapsFunctionDeclarations() throws Exception {
        assertThat(single("function add(x, y) { return x + y; }")).isEqualTo(new FunctionDeclaration("add", List.of("x", "y"),
                new BlockStatement(List.of(new ReturnStatement(new BinaryExpression("+", id("x"), id("y")))))));
    }

    @Test
    @Tag("unit")
    void mapsForeignConstructsToUnsupportedNodes() throws Exception {
        assertThat(((ExpressionStatement) single("x = -1;")).expression())
                .isEqualTo(AssignmentExpression.assign(id("x"), new UnsupportedNode("UnaryExpression")));
        assertThat(((ExpressionStatement) single("f(1);")).expression()).isEqualTo(new UnsupportedNode("FunctionCall"));
        assertThat(single("do { } while (a);")).isEqualTo(new UnsupportedNode("DoLoop"));
    }

    @Test
    @Tag("unit")
    void keepsOperatorsTheTranslatorDoesNotSupport() throws Exception {
        assertThat(((ExpressionStatement) single("x === y;")).expression())
                .isEqualTo(new BinaryExpression("===", id("x"), id("y")));
    }

    @Test
    @Tag("unit")
    void reportsSyntaxErrorsWithLineNumber() {
        assertThatThrownBy(() -> parser.parse("var a = 1;\nvar = ;", "broken.js"))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("line 2")
                .extracting(e -> ((TranslationException) e).getErrorCode())
                .isEqualTo(TranslationErrorCode.SYNTAX_ERROR);
    }
}
