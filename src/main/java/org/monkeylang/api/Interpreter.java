package org.monkeylang.api;

import org.monkeylang.compiler.diagnostics.DiagnosticsEngine;
import org.monkeylang.compiler.frontend.lexer.Lexer;
import org.monkeylang.compiler.frontend.parser.ParseRuleRegistry;
import org.monkeylang.compiler.frontend.parser.ParseTracer;
import org.monkeylang.compiler.frontend.parser.Parser;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.config.InterpreterConfig;
import org.monkeylang.runtime.Evaluator;
import org.monkeylang.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for embedding the interpreter: lexes, parses and evaluates source text.
 * <p>
 * A tree is only evaluated if it parsed without errors. Each call uses a fresh lexer and
 * parser; the evaluator is stateless, so one instance can serve concurrent callers.
 */
public class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final InterpreterConfig config;
    private final Evaluator evaluator = new Evaluator();

    /**
     * Creates an interpreter with the default configuration.
     */
    public Interpreter() {
        this(InterpreterConfig.defaults());
    }

    /**
     * @param config the interpreter settings.
     */
    public Interpreter(InterpreterConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Parses source text.
     *
     * @param source the program text.
     * @return the syntax tree.
     * @throws ParseFailedException if the parser reported any error.
     */
    public Program parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source), diagnostics,
                ParseRuleRegistry.initialize(), new ParseTracer(config.traceParsing()));
        Program program = parser.parseProgram();
        if (diagnostics.hasErrors()) {
            LOG.debug("Rejecting program with {} parse error(s):{}{}",
                    parser.errors().size(), System.lineSeparator(), diagnostics.summary());
            throw new ParseFailedException(parser.diagnostics());
        }
        return program;
    }

    /**
     * Parses and evaluates source text.
     *
     * @param source the program text.
     * @return the value of the last statement, or empty if it has no value.
     * @throws ParseFailedException if the parser reported any error.
     */
    public Optional<Value> evaluate(String source) {
        return evaluator.eval(parse(source));
    }
}
