package org.monkeylang.compiler.diagnostics;

/**
 * A single error reported during compilation.
 *
 * @param message The human-readable description.
 * @param line    The 1-based line of the offending token, or 0 if unknown.
 * @param column  The 1-based column of the offending token, or 0 if unknown.
 */
public record Diagnostic(String message, int line, int column) {

    @Override
    public String toString() {
        return String.format("%d:%d: %s", line, column, message);
    }
}
