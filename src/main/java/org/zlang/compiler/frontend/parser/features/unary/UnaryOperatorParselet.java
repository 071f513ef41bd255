package org.zlang.compiler.frontend.parser.features.unary;

import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parselet.IPrefixParselet;
import org.zlang.compiler.frontend.parselet.Precedence;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * Parselet for the prefix operators {@code +}, {@code -} and {@code !}.
 */
public class UnaryOperatorParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context, Token token) {
        context.advance(); // move to the start of the operand
        Expression operand = context.parseExpression(Precedence.PREFIX);
        return new UnaryOperatorExpression(token.type(), operand);
    }
}
