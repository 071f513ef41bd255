package org.zlang.compiler.frontend.parser.features.assign;

import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * An assignment or compound assignment such as {@code a = b} or {@code a += 1}.
 *
 * @param target The name of the assigned variable.
 * @param operator The assignment operator.
 * @param value The assigned expression.
 */
public record AssignExpression(String target, TokenType operator, Expression value) implements Expression {

    @Override
    public String toString() {
        return "(" + target + " " + operator.canonicalText() + " " + value + ")";
    }
}
