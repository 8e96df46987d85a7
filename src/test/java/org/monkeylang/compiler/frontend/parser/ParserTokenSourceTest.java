package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.lexer.TokenSource;
import org.monkeylang.compiler.frontend.parser.ast.LetStatement;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.compiler.model.Token;
import org.monkeylang.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests how the {@link Parser} pulls tokens from an arbitrary {@link TokenSource}.
 */
@ExtendWith(MockitoExtension.class)
public class ParserTokenSourceTest {

    @Mock
    private TokenSource source;

    private static Token token(TokenType type, String literal) {
        return new Token(type, literal);
    }

    @Test
    @Tag("unit")
    void immediateEndOfInputYieldsEmptyProgram() {
        when(source.nextToken()).thenReturn(token(TokenType.EOF, ""));

        Parser parser = new Parser(source);
        Program program = parser.parseProgram();

        assertThat(program.statements()).isEmpty();
        assertThat(program.tokenLiteral()).isEmpty();
        assertThat(parser.errors()).isEmpty();
    }

    @Test
    @Tag("unit")
    void readsTwoTokensOnConstruction() {
        when(source.nextToken()).thenReturn(token(TokenType.INT, "1"), token(TokenType.EOF, ""));

        new Parser(source);

        verify(source, times(2)).nextToken();
    }

    @Test
    @Tag("unit")
    void parsesFromHandWrittenTokenStream() {
        when(source.nextToken()).thenReturn(
                token(TokenType.LET, "let"),
                token(TokenType.IDENT, "x"),
                token(TokenType.ASSIGN, "="),
                token(TokenType.INT, "5"),
                token(TokenType.SEMICOLON, ";"),
                token(TokenType.EOF, ""));

        Parser parser = new Parser(source);
        Program program = parser.parseProgram();

        assertThat(parser.errors()).isEmpty();
        assertThat(program.statements()).hasSize(1);
        LetStatement let = (LetStatement) program.statements().get(0);
        assertThat(let.name().value()).isEqualTo("x");
        verify(source, atLeast(6)).nextToken();
    }
}
