package org.zlang.compiler.frontend.parser.ast;

/**
 * Marker interface for the top-level units of a {@link Program}.
 */
public interface Statement extends AstNode {
}
