package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.diagnostics.DiagnosticsEngine;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.model.Token;
import org.monkeylang.compiler.model.TokenType;

/**
 * Provides parse rules with access to the token stream.
 * This interface decouples rules from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {

    /**
     * @return The token currently under the cursor.
     */
    Token current();

    /**
     * @return The token after the current one, without consuming anything.
     */
    Token peek();

    /**
     * Moves the cursor one token forward.
     */
    void advance();

    /**
     * Checks if the current token is of the given type.
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    boolean currentIs(TokenType type);

    /**
     * Checks if the next token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean peekIs(TokenType type);

    /**
     * Advances if the next token is of the expected type. If not, reports an error and stays put.
     * @param type The expected token type.
     * @return true if the token matched and the cursor moved.
     */
    boolean expectPeek(TokenType type);

    /**
     * @return The infix precedence of the current token.
     */
    Precedence currentPrecedence();

    /**
     * Parses an expression whose operators all bind tighter than {@code precedence}.
     * @param precedence The binding power of the operator to the left of the expression.
     * @return The parsed expression, or {@code null} if none could be parsed.
     */
    Expression parseExpression(Precedence precedence);

    /**
     * Gets the diagnostics engine for reporting errors.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();
}
