package org.zlang.compiler.frontend.parser.ast;

import org.zlang.compiler.frontend.lexer.TokenType;

import java.util.Objects;

/**
 * A statement consisting of a single expression followed by the statement terminator.
 *
 * @param expression The wrapped expression.
 */
public record ExpressionStatement(Expression expression) implements Statement {

    public ExpressionStatement {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public String toString() {
        return expression + TokenType.SEMICOLON.canonicalText();
    }
}
