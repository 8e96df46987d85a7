package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

/**
 * A reference to a name.
 *
 * @param token The {@code IDENT} token.
 * @param value The name.
 */
public record Identifier(Token token, String value) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
