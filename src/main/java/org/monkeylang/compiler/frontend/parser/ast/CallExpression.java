package org.monkeylang.compiler.frontend.parser.ast;

import org.monkeylang.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A function application, e.g. {@code add(1, 2 * 3)}.
 *
 * @param token     The {@code (} token.
 * @param function  The expression that yields the callee.
 * @param arguments The arguments in source order. Elements are {@code null} where an argument
 *                  could not be parsed.
 */
public record CallExpression(Token token, Expression function, List<Expression> arguments) implements Expression {

    public CallExpression {
        arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCallExpression(this);
    }

    @Override
    public String toString() {
        String args = arguments.stream()
                .map(a -> Objects.toString(a, ""))
                .collect(Collectors.joining(", "));
        return Objects.toString(function, "") + "(" + args + ")";
    }
}
