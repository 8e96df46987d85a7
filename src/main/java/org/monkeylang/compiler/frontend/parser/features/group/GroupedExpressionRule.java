package org.monkeylang.compiler.frontend.parser.features.group;

import org.monkeylang.compiler.frontend.parser.IPrefixParseRule;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.model.TokenType;

/**
 * Parses a parenthesized expression. No node is created for the parentheses themselves;
 * they only reset the precedence to {@link Precedence#LOWEST}.
 */
public class GroupedExpressionRule implements IPrefixParseRule {

    @Override
    public Expression parse(ParsingContext context) {
        context.advance(); // consume (
        Expression inner = context.parseExpression(Precedence.LOWEST);
        if (!context.expectPeek(TokenType.RPAREN)) {
            return null;
        }
        return inner;
    }
}
