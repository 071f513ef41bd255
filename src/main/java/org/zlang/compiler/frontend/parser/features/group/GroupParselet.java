package org.zlang.compiler.frontend.parser.features.group;

import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parselet.IPrefixParselet;
import org.zlang.compiler.frontend.parselet.Precedence;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * Parselet for parentheses used to group an expression, like {@code 5 * (2 + 3)}.
 * Grouping produces no node of its own; the inner expression is returned.
 */
public class GroupParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context, Token token) {
        context.advance(); // move past '('
        Expression expression = context.parseExpression(Precedence.DEFAULT);
        context.expectNext(TokenType.RPAREN, CompilerErrorCode.UNCLOSED_GROUP,
                "The grouped expression must end with a right parenthesis.");
        return expression;
    }
}
