package org.monkeylang.compiler.frontend.lexer;

import org.monkeylang.compiler.model.Token;

/**
 * A pull-based stream of tokens consumed by the {@link org.monkeylang.compiler.frontend.parser.Parser}.
 *
 * <p>Implementations must eventually produce a token of type
 * {@link org.monkeylang.compiler.model.TokenType#EOF} and keep returning it on every further call.
 */
@FunctionalInterface
public interface TokenSource {

    /**
     * Produces the next token of the stream.
     * @return The next token, never null.
     */
    Token nextToken();
}
