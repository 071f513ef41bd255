package org.zlang.compiler.frontend.parselet;

import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * Parses an expression that starts with a given token type, such as a literal,
 * an identifier, a prefix operator or an opening parenthesis.
 */
@FunctionalInterface
public interface IPrefixParselet {

    /**
     * Parses the expression starting at {@code token}.
     *
     * @param context The parser; its current token is {@code token}.
     * @param token The token that selected this parselet.
     * @return The parsed expression. When this returns, the context's current token is the
     *         last token of the expression.
     */
    Expression parse(ParsingContext context, Token token);
}
