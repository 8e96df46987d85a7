package org.monkeylang.compiler.diagnostics;

import org.monkeylang.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects errors reported by the compiler phases.
 * Reporting never throws; phases keep going and the caller inspects the collected messages
 * once the phase has finished.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error located at the given token.
     * @param message The error message.
     * @param token   The token the error refers to. Its position is recorded.
     */
    public void reportError(String message, Token token) {
        Diagnostic diagnostic = new Diagnostic(message, token.line(), token.column());
        LOG.debug("Parse error at {}", diagnostic);
        diagnostics.add(diagnostic);
    }

    /**
     * @return true if at least one error has been reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns the messages of all reported errors in the order they were reported.
     * @return An unmodifiable list of error messages.
     */
    public List<String> errorMessages() {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }

    /**
     * @return An unmodifiable view of every diagnostic reported so far.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Summarizes all diagnostics, one per line.
     * @return The formatted summary, or an empty string if nothing was reported.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
