package org.zlang.compiler.frontend.parser.features.literal;

import org.zlang.compiler.frontend.parser.ast.Expression;

import java.util.Objects;

/**
 * A double-quoted string literal. The content is kept verbatim; there are no escapes.
 *
 * @param value The content between the quotes.
 */
public record StringLiteralExpression(String value) implements Expression {

    public StringLiteralExpression {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
