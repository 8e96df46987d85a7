package org.monkeylang.compiler.frontend.parser.features.prefix;

import org.monkeylang.compiler.frontend.parser.IPrefixParseRule;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.PrefixExpression;
import org.monkeylang.compiler.model.Token;

/**
 * Parses the unary operators {@code !} and {@code -}.
 * The operand binds at {@link Precedence#PREFIX}, so {@code -a * b} is {@code ((-a) * b)}.
 */
public class PrefixOperatorRule implements IPrefixParseRule {

    @Override
    public Expression parse(ParsingContext context) {
        Token operator = context.current();
        context.advance();
        Expression right = context.parseExpression(Precedence.PREFIX);
        return new PrefixExpression(operator, operator.literal(), right);
    }
}
