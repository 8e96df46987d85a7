package org.monkeylang.compiler.frontend.parser.features.literal;

import org.monkeylang.compiler.frontend.parser.IPrefixParseRule;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;
import org.monkeylang.compiler.model.Token;

/**
 * Parses a name reference.
 */
public class IdentifierRule implements IPrefixParseRule {

    @Override
    public Expression parse(ParsingContext context) {
        Token token = context.current();
        return new Identifier(token, token.literal());
    }
}
