package org.monkeylang.compiler.frontend.parser.features.literal;

import org.monkeylang.compiler.frontend.parser.IPrefixParseRule;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.ast.BooleanLiteral;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.model.TokenType;

/**
 * Parses the keywords {@code true} and {@code false}.
 */
public class BooleanLiteralRule implements IPrefixParseRule {

    @Override
    public Expression parse(ParsingContext context) {
        return new BooleanLiteral(context.current(), context.currentIs(TokenType.TRUE));
    }
}
