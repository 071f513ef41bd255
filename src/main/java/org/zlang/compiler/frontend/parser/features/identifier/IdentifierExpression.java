package org.zlang.compiler.frontend.parser.features.identifier;

import org.zlang.compiler.frontend.parser.ast.Expression;

import java.util.Objects;

/**
 * An AST node that represents a reference to a named variable.
 *
 * @param name The identifier as written in the source.
 */
public record IdentifierExpression(String name) implements Expression {

    public IdentifierExpression {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name;
    }
}
