package org.zlang.compiler.api;

/**
 * An exception that is thrown when an error occurs while scanning or parsing.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the defect, or {@code null} if unknown.
     * @param cause The cause, or {@code null}.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo), cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /** @return The error code. */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /** @return The position of the defect, or {@code null} if unknown. */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
