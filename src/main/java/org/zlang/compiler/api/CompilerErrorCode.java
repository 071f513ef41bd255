package org.zlang.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while scanning or parsing.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A string literal was not closed before the end of the input. */
    UNTERMINATED_STRING,
    /** A numeral contained a second decimal point or a second exponent marker. */
    MALFORMED_NUMBER,
    /** A character that does not start any token was found. */
    ILLEGAL_CHARACTER,
    // endregion

    // region Parser Errors
    /** No prefix parselet is registered for the token that starts an expression. */
    NO_PARSELET,
    /** A grouped expression was not closed with ')'. */
    UNCLOSED_GROUP,
    /** The left side of an assignment is not a bare identifier. */
    INVALID_ASSIGNMENT_TARGET,
    /** A statement was not closed with its terminator. */
    MISSING_TERMINATOR,
    /** A number token could not be converted into a literal value. */
    INVALID_NUMBER_LITERAL,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
