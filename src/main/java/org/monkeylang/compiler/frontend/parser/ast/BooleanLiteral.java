package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

/**
 * The literal {@code true} or {@code false}.
 *
 * @param token The {@code TRUE} or {@code FALSE} token.
 * @param value The literal value.
 */
public record BooleanLiteral(Token token, boolean value) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }

    @Override
    public String toString() {
        return token.literal();
    }
}
