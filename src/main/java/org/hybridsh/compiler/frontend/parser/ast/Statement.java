package org.hybridsh.compiler.frontend.parser.ast;

/**
 * A node that can stand on its own inside a {@link Block}.
 */
public interface Statement extends AstNode {

    /**
     * Returns a copy of this statement located at the given position. Children are shared.
     *
     * @param position The new position.
     * @return A statement equal to this one except for its position.
     */
    Statement withPosition(SourcePosition position);
}
