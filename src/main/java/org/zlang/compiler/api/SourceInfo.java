package org.zlang.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical name of the source.
 * @param lineNumber The 1-based line number, or 0 if unknown.
 * @param columnNumber The 1-based column number, or 0 if unknown.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
