package org.monkeylang.compiler.model;

/**
 * Represents a single token produced by the lexer.
 *
 * @param type    The type of the token.
 * @param literal The raw text of the token as it appeared in the source.
 * @param line    The 1-based line number where the token starts, or 0 if unknown.
 * @param column  The 1-based column number where the token starts, or 0 if unknown.
 */
public record Token(TokenType type, String literal, int line, int column) {

    /**
     * Creates a token without position information.
     * @param type    The type of the token.
     * @param literal The raw text of the token.
     */
    public Token(TokenType type, String literal) {
        this(type, literal, 0, 0);
    }

    /**
     * Checks whether this token is of the given type.
     * @param expected The type to compare against.
     * @return true if the types match.
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }
}
