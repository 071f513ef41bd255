package org.zlang.compiler.frontend.parser.features.unary;

import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * A prefix operator applied to an operand: {@code -1}, {@code +x}, {@code !flag}.
 *
 * @param operator The operator.
 * @param operand The operand.
 */
public record UnaryOperatorExpression(TokenType operator, Expression operand) implements Expression {

    @Override
    public String toString() {
        return "(" + operator.canonicalText() + operand + ")";
    }
}
