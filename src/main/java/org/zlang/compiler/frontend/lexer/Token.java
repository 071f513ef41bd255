package org.zlang.compiler.frontend.lexer;

import java.util.Objects;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, number, an operator).
 * @param text The exact text of the token from the source code. Defaults to the
 *             canonical text of the type when {@code null} is supplied.
 * @param line The 1-based line number where the token begins, or 0 if unknown.
 * @param column The 1-based column number where the token begins, or 0 if unknown.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {

    public Token {
        Objects.requireNonNull(type, "type");
        if (text == null) {
            text = type.canonicalText();
        }
    }

    /**
     * Creates a token without position information whose text is the canonical text of its type.
     * @param type The token type.
     */
    public Token(TokenType type) {
        this(type, null, 0, 0);
    }

    /**
     * Creates a token without position information.
     * @param type The token type.
     * @param text The source text, or {@code null} for the canonical text.
     */
    public Token(TokenType type, String text) {
        this(type, text, 0, 0);
    }

    @Override
    public String toString() {
        return type.name() + "('" + text + "')";
    }
}
