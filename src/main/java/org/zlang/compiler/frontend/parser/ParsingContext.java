package org.zlang.compiler.frontend.parser;

import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parselet.Precedence;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * An interface that encapsulates the parser state handed to parselets.
 * It provides access to the token cursor and to recursive expression parsing
 * without coupling parselets to the parser implementation.
 */
public interface ParsingContext {

    /**
     * Returns the token the parser is positioned on.
     * @return The current token, or {@code null} past the end of input.
     */
    Token current();

    /**
     * Returns the token after the current one without consuming it.
     * @return The lookahead token, or {@code null} past the end of input.
     */
    Token lookahead();

    /**
     * Moves the lookahead token into the current slot and pulls the next token.
     * @return The new current token, or {@code null} past the end of input.
     */
    Token advance();

    /**
     * Advances and requires the new current token to be of the given type.
     * @param type The expected token type.
     * @param errorCode The error code to report if the type does not match.
     * @param errorMessage The error message to report if the type does not match.
     * @return The new current token.
     * @throws ParserException if the new current token is missing or of another type.
     */
    Token expectNext(TokenType type, CompilerErrorCode errorCode, String errorMessage);

    /**
     * Parses an expression starting at the current token. Infix operators are consumed
     * while they bind tighter than {@code precedence}.
     * @param precedence The binding strength of the operator the expression is an operand of.
     * @return The parsed expression.
     * @throws ParserException if no expression can be parsed.
     */
    Expression parseExpression(Precedence precedence);
}
