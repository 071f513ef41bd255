package org.zlang.compiler.frontend.parser.features.identifier;

import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parselet.IPrefixParselet;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * Parselet for a bare identifier like {@code foo}.
 */
public class IdentifierParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context, Token token) {
        return new IdentifierExpression(token.text());
    }
}
