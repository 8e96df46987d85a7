package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

import java.util.Objects;

/**
 * A binary operator between two operands, e.g. {@code a + b}.
 *
 * @param token    The operator token.
 * @param left     The left operand.
 * @param operator The operator text.
 * @param right    The right operand, or {@code null} if it could not be parsed.
 */
public record InfixExpression(Token token, Expression left, String operator, Expression right) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInfixExpression(this);
    }

    @Override
    public String toString() {
        return "(" + Objects.toString(left, "") + " " + operator + " " + Objects.toString(right, "") + ")";
    }
}
