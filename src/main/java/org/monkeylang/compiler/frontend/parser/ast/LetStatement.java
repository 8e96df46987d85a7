package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

import java.util.Objects;

/**
 * A binding of the form {@code let <name> = <value>;}.
 *
 * <p>The parser does not capture the bound expression yet: it skips the tokens up to the
 * terminating semicolon, so {@code value} is always {@code null} for parsed statements.
 *
 * @param token The {@code let} token.
 * @param name  The bound identifier.
 * @param value The bound expression, or {@code null} if it was not parsed.
 */
public record LetStatement(Token token, Identifier name, Expression value) implements Statement {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLetStatement(this);
    }

    @Override
    public String toString() {
        return tokenLiteral() + " " + name + " = " + Objects.toString(value, "") + ";";
    }
}
