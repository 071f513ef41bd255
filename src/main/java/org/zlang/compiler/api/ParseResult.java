package org.zlang.compiler.api;

import org.zlang.compiler.diagnostics.Diagnostic;
import org.zlang.compiler.frontend.parser.ast.Program;

import java.util.Optional;

/**
 * The outcome of a parse: either a complete {@link Program} or the single error that stopped it.
 *
 * @param program The parsed program, or {@code null} on failure.
 * @param error The error, or {@code null} on success.
 */
public record ParseResult(Program program, Diagnostic error) {

    public ParseResult {
        if ((program == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of program and error must be present.");
        }
    }

    /**
     * @param program The parsed program.
     * @return A successful result.
     */
    public static ParseResult success(Program program) {
        return new ParseResult(program, null);
    }

    /**
     * @param error The error that stopped the parse.
     * @return A failed result.
     */
    public static ParseResult failure(Diagnostic error) {
        return new ParseResult(null, error);
    }

    /** @return true if the source parsed without error. */
    public boolean isSuccess() {
        return program != null;
    }

    /** @return The program, if parsing succeeded. */
    public Optional<Program> getProgram() {
        return Optional.ofNullable(program);
    }

    /** @return The error, if parsing failed. */
    public Optional<Diagnostic> getError() {
        return Optional.ofNullable(error);
    }
}
