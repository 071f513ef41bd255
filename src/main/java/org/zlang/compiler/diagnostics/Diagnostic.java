package org.zlang.compiler.diagnostics;

import org.zlang.compiler.api.CompilerErrorCode;

/**
 * Represents a single error that stopped scanning or parsing.
 *
 * @param code The error code.
 * @param message The diagnostic message.
 * @param fileName The name of the source where the issue occurred.
 * @param lineNumber The line number of the issue, or 0 if unknown.
 * @param columnNumber The column number of the issue, or 0 if unknown.
 */
public record Diagnostic(
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", code, fileName, lineNumber, columnNumber, message);
    }
}
