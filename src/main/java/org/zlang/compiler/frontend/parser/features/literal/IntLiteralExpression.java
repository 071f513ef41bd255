package org.zlang.compiler.frontend.parser.features.literal;

import org.zlang.compiler.frontend.parser.ast.Expression;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer literal, written in decimal or with a {@code 0x} prefix in hexadecimal.
 * Integers are not bounded in size.
 *
 * @param value The integer value.
 */
public record IntLiteralExpression(BigInteger value) implements Expression {

    public IntLiteralExpression {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
