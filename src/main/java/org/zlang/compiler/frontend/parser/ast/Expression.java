package org.zlang.compiler.frontend.parser.ast;

/**
 * Marker interface for nodes that produce a value.
 * <p>
 * Implementations render their canonical, fully parenthesized source form from
 * {@link Object#toString()}.
 */
public interface Expression extends AstNode {
}
