package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.diagnostics.Diagnostic;
import org.monkeylang.compiler.diagnostics.DiagnosticsEngine;
import org.monkeylang.compiler.frontend.lexer.TokenSource;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.ExpressionStatement;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;
import org.monkeylang.compiler.frontend.parser.ast.LetStatement;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.compiler.frontend.parser.ast.ReturnStatement;
import org.monkeylang.compiler.frontend.parser.ast.Statement;
import org.monkeylang.compiler.model.Token;
import org.monkeylang.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The parser for the Monkey language.
 *
 * <p>Statements are parsed by recursive descent; expressions by operator precedence (Pratt)
 * parsing, where every token type owns a prefix and/or infix rule looked up in a
 * {@link ParseRuleRegistry}. The parser pulls tokens one at a time from a {@link TokenSource}
 * and keeps exactly one token of lookahead.
 *
 * <p>Errors never stop the parse. They are reported to the {@link DiagnosticsEngine} and the
 * affected node is left out or degraded to {@code null}; callers must check {@link #errors()}
 * before trusting the resulting tree.
 */
public class Parser implements ParsingContext {

    private final TokenSource tokens;
    private final DiagnosticsEngine diagnostics;
    private final ParseRuleRegistry rules;
    private final ParseTracer tracer;

    private Token currentToken;
    private Token peekToken;

    /**
     * Constructs a parser with its own diagnostics engine and the built-in grammar.
     * @param tokens The token source to read from.
     */
    public Parser(TokenSource tokens) {
        this(tokens, new DiagnosticsEngine());
    }

    /**
     * Constructs a parser with the built-in grammar.
     * @param tokens      The token source to read from.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(TokenSource tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, ParseRuleRegistry.initialize(), ParseTracer.DISABLED);
    }

    /**
     * Constructs a parser.
     * @param tokens      The token source to read from.
     * @param diagnostics The engine for reporting errors.
     * @param rules       The prefix and infix rules of the grammar.
     * @param tracer      The tracer notified on entry and exit of parse functions.
     */
    public Parser(TokenSource tokens, DiagnosticsEngine diagnostics, ParseRuleRegistry rules, ParseTracer tracer) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.tracer = Objects.requireNonNull(tracer, "tracer");

        // Fill both currentToken and peekToken.
        advance();
        advance();
    }

    /**
     * Parses the whole token stream into a program.
     * This is the main entry point for the parsing phase.
     * @return The program. Statements that failed to parse are left out.
     */
    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!currentIs(TokenType.EOF)) {
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
            advance();
        }
        return new Program(statements);
    }

    /**
     * @return The messages of all errors reported so far, in order.
     */
    public List<String> errors() {
        return diagnostics.errorMessages();
    }

    /**
     * @return All errors reported so far, with their source positions.
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics.getDiagnostics();
    }

    private Statement parseStatement() {
        switch (currentToken.type()) {
            case LET:
                return parseLetStatement();
            case RETURN:
                return parseReturnStatement();
            default:
                return parseExpressionStatement();
        }
    }

    private LetStatement parseLetStatement() {
        tracer.begin("parseLetStatement");
        try {
            Token letToken = currentToken;
            if (!expectPeek(TokenType.IDENT)) {
                return null;
            }
            Identifier name = new Identifier(currentToken, currentToken.literal());
            if (!expectPeek(TokenType.ASSIGN)) {
                return null;
            }
            // The bound expression is not parsed yet.
            skipToStatementEnd();
            return new LetStatement(letToken, name, null);
        } finally {
            tracer.end("parseLetStatement");
        }
    }

    private ReturnStatement parseReturnStatement() {
        tracer.begin("parseReturnStatement");
        try {
            Token returnToken = currentToken;
            advance();
            // The returned expression is not parsed yet.
            skipToStatementEnd();
            return new ReturnStatement(returnToken, null);
        } finally {
            tracer.end("parseReturnStatement");
        }
    }

    private ExpressionStatement parseExpressionStatement() {
        tracer.begin("parseExpressionStatement");
        try {
            Token first = currentToken;
            Expression expression = parseExpression(Precedence.LOWEST);
            if (peekIs(TokenType.SEMICOLON)) {
                advance();
            }
            return new ExpressionStatement(first, expression);
        } finally {
            tracer.end("parseExpressionStatement");
        }
    }

    private void skipToStatementEnd() {
        while (!currentIs(TokenType.SEMICOLON) && !currentIs(TokenType.EOF)) {
            advance();
        }
    }

    @Override
    public Expression parseExpression(Precedence precedence) {
        tracer.begin("parseExpression");
        try {
            Optional<IPrefixParseRule> prefix = rules.resolvePrefix(currentToken.type());
            if (prefix.isEmpty()) {
                diagnostics.reportError("no prefix parse function for " + currentToken.type() + " found", currentToken);
                return null;
            }
            Expression left = prefix.get().parse(this);

            while (!peekIs(TokenType.SEMICOLON) && precedence.isLowerThan(peekPrecedence())) {
                Optional<IInfixParseRule> infix = rules.resolveInfix(peekToken.type());
                if (infix.isEmpty()) {
                    return left;
                }
                advance();
                left = infix.get().parse(this, left);
            }
            return left;
        } finally {
            tracer.end("parseExpression");
        }
    }

    // --- Token stream navigation ---

    @Override
    public Token current() {
        return currentToken;
    }

    @Override
    public Token peek() {
        return peekToken;
    }

    @Override
    public void advance() {
        currentToken = peekToken;
        peekToken = tokens.nextToken();
    }

    @Override
    public boolean currentIs(TokenType type) {
        return currentToken != null && currentToken.is(type);
    }

    @Override
    public boolean peekIs(TokenType type) {
        return peekToken.is(type);
    }

    @Override
    public boolean expectPeek(TokenType type) {
        if (peekIs(type)) {
            advance();
            return true;
        }
        diagnostics.reportError("expected next token to be " + type + ", got " + peekToken.type() + " instead", peekToken);
        return false;
    }

    @Override
    public Precedence currentPrecedence() {
        return Precedence.of(currentToken.type());
    }

    private Precedence peekPrecedence() {
        return Precedence.of(peekToken.type());
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
