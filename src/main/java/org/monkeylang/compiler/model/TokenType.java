package org.monkeylang.compiler.model;

import java.util.Map;
import java.util.Optional;

/**
 * Defines the types of tokens that the {@link org.monkeylang.compiler.frontend.lexer.Lexer} can produce.
 */
public enum TokenType {
    // Special
    ILLEGAL,
    EOF,

    // Identifiers and literals
    IDENT,
    INT,

    // Operators
    ASSIGN,
    PLUS,
    MINUS,
    BANG,
    ASTERISK,
    SLASH,
    LT,
    GT,
    EQ,
    NOT_EQ,

    // Delimiters
    COMMA,
    SEMICOLON,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,

    // Keywords
    FUNCTION,
    LET,
    TRUE,
    FALSE,
    IF,
    ELSE,
    RETURN;

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "fn", FUNCTION,
            "let", LET,
            "true", TRUE,
            "false", FALSE,
            "if", IF,
            "else", ELSE,
            "return", RETURN
    );

    /**
     * Looks up the keyword token type for an identifier.
     * @param identifier The scanned identifier text.
     * @return The keyword type, or empty if the text is an ordinary identifier.
     */
    public static Optional<TokenType> keyword(String identifier) {
        return Optional.ofNullable(KEYWORDS.get(identifier));
    }
}
