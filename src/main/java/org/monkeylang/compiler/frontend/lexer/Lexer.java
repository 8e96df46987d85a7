package org.monkeylang.compiler.frontend.lexer;

import org.monkeylang.compiler.model.Token;
import org.monkeylang.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The lexer (or scanner) for the Monkey language.
 * It converts raw source text into tokens on demand. Unknown characters become
 * {@link TokenType#ILLEGAL} tokens rather than errors, leaving it to the parser to report them.
 */
public class Lexer implements TokenSource {

    private final String source;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Constructs a new Lexer.
     * @param source The source code to be tokenized.
     */
    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Scans the remaining source and returns all tokens, including the final EOF token.
     * @return A list of the scanned tokens.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    @Override
    public Token nextToken() {
        skipWhitespace();

        int startLine = line;
        int startColumn = column;
        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", startLine, startColumn);
        }

        char c = advance();
        switch (c) {
            case '=':
                if (match('=')) return new Token(TokenType.EQ, "==", startLine, startColumn);
                return new Token(TokenType.ASSIGN, "=", startLine, startColumn);
            case '!':
                if (match('=')) return new Token(TokenType.NOT_EQ, "!=", startLine, startColumn);
                return new Token(TokenType.BANG, "!", startLine, startColumn);
            case '+': return new Token(TokenType.PLUS, "+", startLine, startColumn);
            case '-': return new Token(TokenType.MINUS, "-", startLine, startColumn);
            case '*': return new Token(TokenType.ASTERISK, "*", startLine, startColumn);
            case '/': return new Token(TokenType.SLASH, "/", startLine, startColumn);
            case '<': return new Token(TokenType.LT, "<", startLine, startColumn);
            case '>': return new Token(TokenType.GT, ">", startLine, startColumn);
            case ',': return new Token(TokenType.COMMA, ",", startLine, startColumn);
            case ';': return new Token(TokenType.SEMICOLON, ";", startLine, startColumn);
            case '(': return new Token(TokenType.LPAREN, "(", startLine, startColumn);
            case ')': return new Token(TokenType.RPAREN, ")", startLine, startColumn);
            case '{': return new Token(TokenType.LBRACE, "{", startLine, startColumn);
            case '}': return new Token(TokenType.RBRACE, "}", startLine, startColumn);
            default:
                if (isLetter(c)) {
                    String text = readWhile(current - 1, Lexer::isLetter);
                    TokenType type = TokenType.keyword(text).orElse(TokenType.IDENT);
                    return new Token(type, text, startLine, startColumn);
                }
                if (isDigit(c)) {
                    String text = readWhile(current - 1, Lexer::isDigit);
                    return new Token(TokenType.INT, text, startLine, startColumn);
                }
                return new Token(TokenType.ILLEGAL, String.valueOf(c), startLine, startColumn);
        }
    }

    private String readWhile(int start, CharPredicate predicate) {
        while (!isAtEnd() && predicate.test(peek())) {
            advance();
        }
        return source.substring(start, current);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
