package org.zlang.compiler.frontend.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * <p>
 * The enumeration falls into three disjoint groups: sentinels, categories whose text
 * varies with the source (identifiers, numbers, strings), and fixed-text categories
 * (operators, punctuation and keywords) whose canonical text is the token text itself.
 * The keyword and symbol dispatch tables used by the lexer are derived from the
 * fixed-text constants, so a new operator or keyword only needs a new constant here.
 */
public enum TokenType {
    // Sentinels.
    /** Represents an unexpected or unsupported token. */
    ILLEGAL,
    /** Represents the end of the source. */
    END_OF_FILE,

    // Literals.
    /** An identifier, such as a variable name. */
    IDENTIFIER,
    /** A numeric literal (decimal, hexadecimal or floating point). */
    NUMBER,
    /** A string literal; the token text excludes the quotes. */
    STRING,

    // Arithmetic and assignment operators.
    ASSIGN("="),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    DIV_ASSIGN("/="),

    // Logical operators.
    NOT("!"),
    AND("&"),
    OR("|"),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),

    // Comparison operators.
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("=="),
    NEQ("!="),

    // Punctuation.
    COMMA(","),
    SEMICOLON(";"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),

    // Keywords.
    TRUE("true"),
    FALSE("false"),
    LET("let"),
    RETURN("return"),
    FUNCTION("fn"),
    IF("if"),
    ELSE("else");

    private static final Map<String, TokenType> KEYWORDS;
    private static final Map<String, TokenType> SYMBOLS;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        Map<String, TokenType> symbols = new HashMap<>();
        for (TokenType type : values()) {
            if (!type.isFixedText()) continue;
            Map<String, TokenType> table = Character.isLetter(type.text.charAt(0)) ? keywords : symbols;
            TokenType previous = table.put(type.text, type);
            if (previous != null) {
                throw new IllegalStateException("Duplicate token text '" + type.text + "' for " + previous + " and " + type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
        SYMBOLS = Collections.unmodifiableMap(symbols);
    }

    private final String text;

    TokenType() {
        this.text = null;
    }

    TokenType(String text) {
        this.text = text;
    }

    /**
     * Returns whether the category always has the same source text.
     * @return true for operators, punctuation and keywords.
     */
    public boolean isFixedText() {
        return text != null;
    }

    /**
     * Returns the canonical text of this category. For sentinels and variable-text
     * categories this is a placeholder that never occurs in source code.
     * @return The canonical text.
     */
    public String canonicalText() {
        return text != null ? text : "<" + name().toLowerCase() + ">";
    }

    /**
     * Looks up a reserved keyword.
     * @param text The identifier text as it appears in the source.
     * @return The keyword category, or empty if the text is an ordinary identifier.
     */
    public static Optional<TokenType> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    /**
     * Looks up an operator or punctuation symbol.
     * @param text The one- or two-character lexeme.
     * @return The symbol category, or empty if no such symbol exists.
     */
    public static Optional<TokenType> symbol(String text) {
        return Optional.ofNullable(SYMBOLS.get(text));
    }

    /** @return All reserved keyword texts. */
    public static Map<String, TokenType> keywords() {
        return KEYWORDS;
    }

    /** @return All operator and punctuation texts. */
    public static Map<String, TokenType> symbols() {
        return SYMBOLS;
    }
}
