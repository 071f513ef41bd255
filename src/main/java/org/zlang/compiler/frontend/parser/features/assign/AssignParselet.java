package org.zlang.compiler.frontend.parser.features.assign;

import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parselet.IInfixParselet;
import org.zlang.compiler.frontend.parselet.Precedence;
import org.zlang.compiler.frontend.parser.ParserException;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;
import org.zlang.compiler.frontend.parser.features.identifier.IdentifierExpression;

/**
 * Infix parselet for the assignment operators {@code =, +=, -=, *=, /=, &=, |=}.
 * <p>
 * The left side must be a bare identifier. The right side is parsed just below
 * assignment precedence, so {@code a = b = c} groups as {@code a = (b = c)}.
 */
public class AssignParselet implements IInfixParselet {

    @Override
    public Expression parse(ParsingContext context, Expression left, Token token) {
        if (!(left instanceof IdentifierExpression identifier)) {
            throw new ParserException(CompilerErrorCode.INVALID_ASSIGNMENT_TARGET,
                    "The left side of an assignment must be a simple identifier, but got: " + left + ".", token);
        }
        context.advance(); // move to the start of the right side
        Expression value = context.parseExpression(Precedence.ASSIGN_BELOW);
        return new AssignExpression(identifier.name(), token.type(), value);
    }

    @Override
    public Precedence getPrecedence() {
        return Precedence.ASSIGN;
    }
}
