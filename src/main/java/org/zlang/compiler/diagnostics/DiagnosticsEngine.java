package org.zlang.compiler.diagnostics;

import org.zlang.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the errors reported while scanning and parsing.
 * <p>
 * This decouples error reporting from the lexer and the parser.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code         The error code.
     * @param message      The error message.
     * @param fileName     The source in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     * @return The recorded diagnostic.
     */
    public Diagnostic reportError(CompilerErrorCode code, String message, String fileName, int lineNumber, int columnNumber) {
        Diagnostic diagnostic = new Diagnostic(code, message, fileName, lineNumber, columnNumber);
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Removes all collected diagnostics.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
