package org.zlang.compiler.frontend.parser.features.binary;

import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * A binary operator applied to two operands: {@code 1 + 2}, {@code a <= b}, {@code x & y}.
 *
 * @param left The left operand.
 * @param operator The operator.
 * @param right The right operand.
 */
public record BinaryOperatorExpression(Expression left, TokenType operator, Expression right) implements Expression {

    @Override
    public String toString() {
        return "(" + left + " " + operator.canonicalText() + " " + right + ")";
    }
}
