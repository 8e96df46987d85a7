package org.monkeylang.compiler.frontend.lexer;

import org.monkeylang.compiler.model.Token;
import org.monkeylang.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.monkeylang.compiler.model.TokenType.*;

/**
 * Tests the {@link Lexer}.
 */
public class LexerTest {

    @Test
    @Tag("unit")
    void scansOperatorsDelimitersAndKeywords() {
        String source = """
                let five = 5;
                let add = fn(x, y) { x + y; };
                !-/*5;
                5 < 10 > 5;
                if (5 < 10) { return true; } else { return false; }
                10 == 10;
                10 != 9;
                """;

        List<Token> tokens = new Lexer(source).scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                LET, IDENT, ASSIGN, INT, SEMICOLON,
                LET, IDENT, ASSIGN, FUNCTION, LPAREN, IDENT, COMMA, IDENT, RPAREN,
                LBRACE, IDENT, PLUS, IDENT, SEMICOLON, RBRACE, SEMICOLON,
                BANG, MINUS, SLASH, ASTERISK, INT, SEMICOLON,
                INT, LT, INT, GT, INT, SEMICOLON,
                IF, LPAREN, INT, LT, INT, RPAREN, LBRACE, RETURN, TRUE, SEMICOLON, RBRACE,
                ELSE, LBRACE, RETURN, FALSE, SEMICOLON, RBRACE,
                INT, EQ, INT, SEMICOLON,
                INT, NOT_EQ, INT, SEMICOLON,
                EOF);
        assertThat(tokens.get(1).literal()).isEqualTo("five");
        assertThat(tokens.get(3).literal()).isEqualTo("5");
        assertThat(tokens).filteredOn(t -> t.type() == NOT_EQ).extracting(Token::literal).containsExactly("!=");
    }

    @Test
    @Tag("unit")
    void identifiersMayContainUnderscores() {
        List<Token> tokens = new Lexer("foo_bar _x").scanTokens();

        assertThat(tokens).extracting(Token::literal).containsExactly("foo_bar", "_x", "");
        assertThat(tokens.get(0).type()).isEqualTo(IDENT);
    }

    @Test
    @Tag("unit")
    void tracksLineAndColumn() {
        List<Token> tokens = new Lexer("let x = 1;\n  foo").scanTokens();

        Token foo = tokens.get(5);
        assertThat(foo.literal()).isEqualTo("foo");
        assertThat(foo.line()).isEqualTo(2);
        assertThat(foo.column()).isEqualTo(3);
        assertThat(tokens.get(0).column()).isEqualTo(1);
        assertThat(tokens.get(3).column()).isEqualTo(9);
    }

    @Test
    @Tag("unit")
    void unknownCharacterBecomesIllegalToken() {
        List<Token> tokens = new Lexer("5 @ 3").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(INT, ILLEGAL, INT, EOF);
        assertThat(tokens.get(1).literal()).isEqualTo("@");
    }

    @Test
    @Tag("unit")
    void keepsReturningEofAfterEndOfInput() {
        Lexer lexer = new Lexer("x");

        assertThat(lexer.nextToken().type()).isEqualTo(IDENT);
        assertThat(lexer.nextToken().type()).isEqualTo(EOF);
        assertThat(lexer.nextToken().type()).isEqualTo(EOF);
        assertThat(lexer.nextToken().literal()).isEmpty();
    }

    @Test
    @Tag("unit")
    void emptySourceYieldsOnlyEof() {
        assertThat(new Lexer("  \n\t").scanTokens()).extracting(Token::type).containsExactly(TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void rejectsNullSource() {
        assertThatThrownBy(() -> new Lexer(null)).isInstanceOf(NullPointerException.class);
    }
}
