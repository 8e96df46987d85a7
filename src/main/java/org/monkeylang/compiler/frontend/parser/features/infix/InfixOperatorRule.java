package org.monkeylang.compiler.frontend.parser.features.infix;

import org.monkeylang.compiler.frontend.parser.IInfixParseRule;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.InfixExpression;
import org.monkeylang.compiler.model.Token;

/**
 * Parses the binary operators {@code + - * / == != < >}.
 *
 * <p>The right operand is parsed at the operator's own precedence, which makes chains of equal
 * precedence left-associative: {@code a - b - c} is {@code ((a - b) - c)}.
 */
public class InfixOperatorRule implements IInfixParseRule {

    @Override
    public Expression parse(ParsingContext context, Expression left) {
        Token operator = context.current();
        Precedence precedence = context.currentPrecedence();
        context.advance();
        Expression right = context.parseExpression(precedence);
        return new InfixExpression(operator, left, operator.literal(), right);
    }
}
