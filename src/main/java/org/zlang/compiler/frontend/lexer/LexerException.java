package org.zlang.compiler.frontend.lexer;

import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.FrontendException;

/**
 * A lexical error: an unterminated string, a malformed numeral or an illegal character.
 */
public class LexerException extends FrontendException {

    /**
     * @param errorCode The kind of lexical error.
     * @param message A human-readable description naming the offending input.
     * @param line The line where the offending lexeme starts.
     * @param column The column where the offending lexeme starts.
     */
    public LexerException(CompilerErrorCode errorCode, String message, int line, int column) {
        super(errorCode, message, line, column);
    }
}
