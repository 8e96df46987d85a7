package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

/**
 * A 64-bit signed integer literal.
 *
 * @param token The {@code INT} token.
 * @param value The decoded value.
 */
public record IntegerLiteral(Token token, long value) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIntegerLiteral(this);
    }

    @Override
    public String toString() {
        return token.literal();
    }
}
