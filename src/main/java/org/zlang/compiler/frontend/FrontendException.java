package org.zlang.compiler.frontend;

import org.zlang.compiler.api.CompilerErrorCode;

/**
 * Base class for the fatal errors raised by the lexer and the parser.
 * Scanning and parsing stop at the first such error; there is no recovery.
 */
public abstract class FrontendException extends RuntimeException {

    private final CompilerErrorCode errorCode;
    private final int line;
    private final int column;

    protected FrontendException(CompilerErrorCode errorCode, String message, int line, int column) {
        super(message);
        this.errorCode = errorCode;
        this.line = line;
        this.column = column;
    }

    protected FrontendException(CompilerErrorCode errorCode, String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.line = line;
        this.column = column;
    }

    /** @return The error code identifying the kind of defect. */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /** @return The 1-based line of the defect, or 0 if unknown. */
    public int getLine() {
        return line;
    }

    /** @return The 1-based column of the defect, or 0 if unknown. */
    public int getColumn() {
        return column;
    }
}
