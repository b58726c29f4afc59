package org.hybridsh.compiler.frontend.parser.ast;

/**
 * Marker for nodes that evaluate to a value.
 */
public interface Expression extends AstNode {
}
