package org.zlang.compiler.frontend.parser.features.literal;

import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * A {@code true} or {@code false} literal.
 *
 * @param value The boolean value.
 */
public record BoolLiteralExpression(boolean value) implements Expression {

    @Override
    public String toString() {
        return value ? TokenType.TRUE.canonicalText() : TokenType.FALSE.canonicalText();
    }
}
