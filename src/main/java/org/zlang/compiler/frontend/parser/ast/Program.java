package org.zlang.compiler.frontend.parser.ast;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The root of the tree: the ordered statements of a parsed source.
 *
 * @param statements The statements in source order. The list is copied and unmodifiable.
 */
public record Program(List<Statement> statements) implements AstNode, Iterable<Statement> {

    public Program {
        statements = List.copyOf(statements);
    }

    /** @return The number of statements. */
    public int size() {
        return statements.size();
    }

    /** @return true if the program has no statements. */
    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public Iterator<Statement> iterator() {
        return statements.iterator();
    }

    /**
     * Renders the canonical source form, one statement per line.
     */
    @Override
    public String toString() {
        return statements.stream()
                .map(Statement::toString)
                .collect(Collectors.joining("\n"));
    }
}
