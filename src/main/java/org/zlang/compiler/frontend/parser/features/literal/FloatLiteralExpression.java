package org.zlang.compiler.frontend.parser.features.literal;

import org.zlang.compiler.frontend.parser.ast.Expression;

/**
 * A floating-point literal such as {@code 0.5}, {@code 1e-7} or {@code 2.3E7}.
 *
 * @param value The value; always finite.
 */
public record FloatLiteralExpression(double value) implements Expression {

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
