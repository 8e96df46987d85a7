package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

import java.util.Objects;

/**
 * A statement of the form {@code return <value>;}.
 * Like {@link LetStatement}, the returned expression is skipped by the parser for now.
 *
 * @param token       The {@code return} token.
 * @param returnValue The returned expression, or {@code null} if it was not parsed.
 */
public record ReturnStatement(Token token, Expression returnValue) implements Statement {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }

    @Override
    public String toString() {
        return tokenLiteral() + " " + Objects.toString(returnValue, "") + ";";
    }
}
