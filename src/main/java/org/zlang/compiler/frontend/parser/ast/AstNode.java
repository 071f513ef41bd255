package org.zlang.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable records once constructed, each node exclusively owns its children,
 * and two trees are equal when they have the same shape and values. Source positions are
 * not part of a node.
 */
public interface AstNode {
}
