package org.zlang.compiler.frontend.parser.features.binary;

import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parselet.IInfixParselet;
import org.zlang.compiler.frontend.parselet.Precedence;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * Generic infix parselet for a left-associative binary operator.
 * The right operand is parsed at the operator's own precedence.
 */
public class BinaryOperatorParselet implements IInfixParselet {

    private final Precedence precedence;

    /**
     * @param precedence The binding strength of the operator.
     */
    public BinaryOperatorParselet(Precedence precedence) {
        this.precedence = precedence;
    }

    @Override
    public Expression parse(ParsingContext context, Expression left, Token token) {
        context.advance(); // move to the start of the right operand
        Expression right = context.parseExpression(precedence);
        return new BinaryOperatorExpression(left, token.type(), right);
    }

    @Override
    public Precedence getPrecedence() {
        return precedence;
    }
}
