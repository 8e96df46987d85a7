package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;
import org.monkeylang.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests rendering and token retention of hand-built AST nodes.
 */
public class AstNodeTest {

    private static final Token LET = new Token(TokenType.LET, "let");
    private static final Token X = new Token(TokenType.IDENT, "x");
    private static final Token PLUS = new Token(TokenType.PLUS, "+");

    @Test
    @Tag("unit")
    void rendersLetStatementWithValue() {
        Identifier x = new Identifier(X, "x");
        Identifier y = new Identifier(new Token(TokenType.IDENT, "y"), "y");
        Program program = new Program(List.of(new LetStatement(LET, x, y)));

        assertThat(program.toString()).isEqualTo("let x = y;");
        assertThat(program.tokenLiteral()).isEqualTo("let");
    }

    @Test
    @Tag("unit")
    void rendersReturnStatement() {
        IntegerLiteral five = new IntegerLiteral(new Token(TokenType.INT, "5"), 5);
        ReturnStatement statement = new ReturnStatement(new Token(TokenType.RETURN, "return"), five);

        assertThat(statement.toString()).isEqualTo("return 5;");
    }

    @Test
    @Tag("unit")
    void rendersMissingChildrenAsEmpty() {
        InfixExpression infix = new InfixExpression(PLUS, new Identifier(X, "x"), "+", null);
        PrefixExpression prefix = new PrefixExpression(new Token(TokenType.MINUS, "-"), "-", null);
        CallExpression call = new CallExpression(new Token(TokenType.LPAREN, "("), new Identifier(X, "x"),
                Arrays.asList(null, new Identifier(X, "x")));

        assertThat(infix.toString()).isEqualTo("(x + )");
        assertThat(prefix.toString()).isEqualTo("(-)");
        assertThat(call.toString()).isEqualTo("x(, x)");
        assertThat(new ExpressionStatement(PLUS, null).toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void nodesKeepTheirIntroducingToken() {
        InfixExpression infix = new InfixExpression(PLUS, new Identifier(X, "x"), "+", new Identifier(X, "x"));

        assertThat(infix.token()).isSameAs(PLUS);
        assertThat(infix.tokenLiteral()).isEqualTo("+");
        assertThat(new BooleanLiteral(new Token(TokenType.TRUE, "true"), true).tokenLiteral()).isEqualTo("true");
    }

    @Test
    @Tag("unit")
    void callArgumentsAreImmutable() {
        CallExpression call = new CallExpression(new Token(TokenType.LPAREN, "("), new Identifier(X, "x"), List.of());

        assertThat(call.arguments()).isUnmodifiable();
    }
}
