package org.monkeylang.compiler.frontend.parser.features.literal;

import org.monkeylang.compiler.frontend.parser.IPrefixParseRule;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.IntegerLiteral;
import org.monkeylang.compiler.model.Token;

/**
 * Parses an integer literal into a 64-bit signed value.
 *
 * <p>Digits with a leading {@code 0} are read as octal, so {@code 010} is 8 and {@code 09}
 * is rejected. Literals that do not fit into a {@code long} are reported as errors.
 */
public class IntegerLiteralRule implements IPrefixParseRule {

    @Override
    public Expression parse(ParsingContext context) {
        Token token = context.current();
        try {
            return new IntegerLiteral(token, Long.decode(token.literal()));
        } catch (NumberFormatException e) {
            context.getDiagnostics().reportError("could not parse \"" + token.literal() + "\" as integer", token);
            return null;
        }
    }
}
