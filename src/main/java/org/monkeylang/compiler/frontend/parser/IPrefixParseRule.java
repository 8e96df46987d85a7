package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parse rule for a token that can start an expression.
 * On entry the current token is the one the rule is registered for; on exit the current token
 * is the last token of the parsed expression.
 */
@FunctionalInterface
public interface IPrefixParseRule {

    /**
     * @param context The parsing context providing access to the token stream.
     * @return The parsed expression, or {@code null} if the rule reported an error.
     */
    Expression parse(ParsingContext context);
}
