package org.zlang.compiler.frontend.parser;

import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.FrontendException;
import org.zlang.compiler.frontend.lexer.Token;

/**
 * A syntax error. Parsing stops at the first one.
 */
public class ParserException extends FrontendException {

    private final Token token;

    /**
     * @param errorCode The kind of syntax error.
     * @param message A human-readable description.
     * @param token The token at which the error was detected, or {@code null} past the end of input.
     */
    public ParserException(CompilerErrorCode errorCode, String message, Token token) {
        super(errorCode, message, token == null ? 0 : token.line(), token == null ? 0 : token.column());
        this.token = token;
    }

    /**
     * @param errorCode The kind of syntax error.
     * @param message A human-readable description.
     * @param token The token at which the error was detected.
     * @param cause The underlying conversion failure.
     */
    public ParserException(CompilerErrorCode errorCode, String message, Token token, Throwable cause) {
        super(errorCode, message, token == null ? 0 : token.line(), token == null ? 0 : token.column(), cause);
        this.token = token;
    }

    /** @return The token at which the error was detected, or {@code null}. */
    public Token getToken() {
        return token;
    }
}
