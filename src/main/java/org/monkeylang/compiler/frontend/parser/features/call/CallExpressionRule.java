package org.monkeylang.compiler.frontend.parser.features.call;

import org.monkeylang.compiler.frontend.parser.IInfixParseRule;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.CallExpression;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.model.Token;
import org.monkeylang.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a function application: an expression followed by a parenthesized,
 * comma-separated argument list, e.g. {@code add(1, 2 * 3)} or {@code f()}.
 */
public class CallExpressionRule implements IInfixParseRule {

    @Override
    public Expression parse(ParsingContext context, Expression function) {
        Token paren = context.current();
        return parseArguments(context)
                .map(arguments -> (Expression) new CallExpression(paren, function, arguments))
                .orElse(null);
    }

    private Optional<List<Expression>> parseArguments(ParsingContext context) {
        List<Expression> arguments = new ArrayList<>();

        if (context.peekIs(TokenType.RPAREN)) {
            context.advance();
            return Optional.of(arguments);
        }

        context.advance();
        arguments.add(context.parseExpression(Precedence.LOWEST));

        while (context.peekIs(TokenType.COMMA)) {
            context.advance(); // consume ,
            context.advance();
            arguments.add(context.parseExpression(Precedence.LOWEST));
        }

        if (!context.expectPeek(TokenType.RPAREN)) {
            return Optional.empty();
        }
        return Optional.of(arguments);
    }
}
