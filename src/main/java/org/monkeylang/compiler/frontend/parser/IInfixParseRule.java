package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parse rule for a token that continues an already parsed expression, such as a binary operator.
 * On entry the current token is the operator; on exit it is the last token of the combined expression.
 */
@FunctionalInterface
public interface IInfixParseRule {

    /**
     * @param context The parsing context providing access to the token stream.
     * @param left    The expression to the left of the operator.
     * @return The combined expression, or {@code null} if the rule reported an error.
     */
    Expression parse(ParsingContext context, Expression left);
}
