package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

import java.util.Objects;

/**
 * A bare expression used as a statement, e.g. {@code x + 10;}.
 *
 * @param token      The first token of the expression.
 * @param expression The wrapped expression, or {@code null} if it could not be parsed.
 */
public record ExpressionStatement(Token token, Expression expression) implements Statement {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override
    public String toString() {
        return Objects.toString(expression, "");
    }
}
