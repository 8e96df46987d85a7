package org.monkeylang.api;

import org.monkeylang.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown by the {@link Interpreter} when the source did not parse cleanly.
 * <p>
 * The parser itself never throws on malformed input; it collects every error it finds.
 * This exception carries that complete list so callers can report all of them at once.
 */
public class ParseFailedException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    /**
     * @param diagnostics the errors reported by the parser, in order. Must not be empty.
     */
    public ParseFailedException(List<Diagnostic> diagnostics) {
        super("Parsing failed with " + diagnostics.size() + " error(s): " + diagnostics);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return the errors reported by the parser, with positions.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return the error messages, in the order they were reported.
     */
    public List<String> getErrors() {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }
}
