package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

import java.util.Objects;

/**
 * A unary operator applied to its operand, e.g. {@code -5} or {@code !ok}.
 *
 * @param token    The operator token.
 * @param operator The operator text.
 * @param right    The operand, or {@code null} if it could not be parsed.
 */
public record PrefixExpression(Token token, String operator, Expression right) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPrefixExpression(this);
    }

    @Override
    public String toString() {
        return "(" + operator + Objects.toString(right, "") + ")";
    }
}
