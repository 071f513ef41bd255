package org.zlang.compiler.frontend.lexer;

import org.zlang.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced lazily: each {@link #iterator()} starts an independent scan that
 * produces the next token only when it is requested and ends with exactly one
 * {@link TokenType#END_OF_FILE} token. A single iterator is forward-only.
 */
public class Lexer implements Iterable<Token> {

    private final String source;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Starts a new scan of the source.
     * @return A lazy, forward-only token iterator.
     */
    @Override
    public Iterator<Token> iterator() {
        return new Scan();
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     * @throws LexerException if the source contains a lexical error.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * One pass over the source. Holds the scanning cursor.
     */
    private final class Scan implements Iterator<Token> {
        private int start = 0;
        private int current = 0;
        private int line = 1;
        private int lineStart = 0;
        private int startLine = 1;
        private int startColumn = 1;
        private boolean finished = false;

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) {
                throw new NoSuchElementException("Token stream is exhausted.");
            }
            while (!isAtEnd()) {
                markStart();
                Token token = scanToken();
                if (token != null) {
                    return token;
                }
            }
            finished = true;
            markStart();
            return new Token(TokenType.END_OF_FILE, null, startLine, startColumn);
        }

        private void markStart() {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
        }

        /**
         * Scans the lexeme at the cursor.
         * @return The token, or {@code null} if the lexeme was whitespace.
         */
        private Token scanToken() {
            char c = advance();
            switch (c) {
                case ' ', '\r', '\t':
                    return null;
                case '\n':
                    line++;
                    lineStart = current;
                    return null;
                case '"':
                    return string();
                case '=', '!', '<', '>', '+', '-', '*', '/', '&', '|':
                    // Maximal munch with one character of lookahead.
                    if (peek() == '=') advance();
                    return symbol();
                case ',', ';', '(', ')', '{', '}', '[', ']':
                    return symbol();
                default:
                    if (isAlpha(c)) {
                        return identifier();
                    }
                    if (isDigit(c)) {
                        return number();
                    }
                    throw error(CompilerErrorCode.ILLEGAL_CHARACTER, "Unknown illegal character: " + c);
            }
        }

        private Token string() {
            while (peek() != '"' && !isAtEnd()) {
                if (advance() == '\n') {
                    line++;
                    lineStart = current;
                }
            }

            if (isAtEnd()) {
                throw error(CompilerErrorCode.UNTERMINATED_STRING, "The string must be enclosed in double quotes.");
            }

            // The closing "
            advance();

            // The text of the token is the content without the quotes.
            return token(TokenType.STRING, source.substring(start + 1, current - 1));
        }

        private Token symbol() {
            String text = source.substring(start, current);
            TokenType type = TokenType.symbol(text)
                    .orElseThrow(() -> new IllegalStateException("No token type for symbol '" + text + "'"));
            return token(type, text);
        }

        private Token identifier() {
            while (isAlphaNumeric(peek())) advance();
            String text = source.substring(start, current);
            // Keywords keep their source spelling as text.
            return token(TokenType.keyword(text).orElse(TokenType.IDENTIFIER), text);
        }

        private Token number() {
            if (previous() == '0' && (peek() == 'x' || peek() == 'X')) {
                advance(); // consume 'x'
                while (isHexDigit(peek())) advance();
                return token(TokenType.NUMBER, source.substring(start, current));
            }

            boolean seenPoint = false;
            boolean seenExponent = false;
            while (!isAtEnd()) {
                char c = peek();
                if (c == '.') {
                    if (seenPoint) {
                        throw error(CompilerErrorCode.MALFORMED_NUMBER,
                                "The decimal point (`.`) can only appear once in a number: " + source.substring(start, current + 1));
                    }
                    seenPoint = true;
                } else if (c == 'e' || c == 'E') {
                    if (seenExponent) {
                        throw error(CompilerErrorCode.MALFORMED_NUMBER,
                                "The exponent marker (`" + c + "`) can only appear once in a number: " + source.substring(start, current + 1));
                    }
                    seenExponent = true;
                } else if (c == '+' || c == '-') {
                    // A sign is only part of the number directly after the exponent marker.
                    if (previous() != 'e' && previous() != 'E') break;
                } else if (!isDigit(c)) {
                    break;
                }
                advance();
            }
            return token(TokenType.NUMBER, source.substring(start, current));
        }

        private Token token(TokenType type, String text) {
            return new Token(type, text, startLine, startColumn);
        }

        private LexerException error(CompilerErrorCode code, String message) {
            return new LexerException(code, message, startLine, startColumn);
        }

        private char advance() {
            return source.charAt(current++);
        }

        private boolean isAtEnd() {
            return current >= source.length();
        }

        private char peek() {
            if (isAtEnd()) return '\0';
            return source.charAt(current);
        }

        private char previous() {
            return source.charAt(current - 1);
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
