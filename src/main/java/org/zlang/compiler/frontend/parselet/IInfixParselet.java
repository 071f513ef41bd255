package org.zlang.compiler.frontend.parselet;

import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * Extends an already parsed expression with an operator token, such as a binary operator.
 */
public interface IInfixParselet {

    /**
     * Parses the rest of the expression.
     *
     * @param context The parser; its current token is the operator token.
     * @param left The expression parsed so far.
     * @param token The operator token that selected this parselet.
     * @return The combined expression.
     */
    Expression parse(ParsingContext context, Expression left, Token token);

    /**
     * Specifies how tightly this operator binds to its left operand.
     * @return The binding precedence.
     */
    Precedence getPrecedence();
}
