package org.hybridsh.compiler.frontend.parser.ast;

/**
 * Capability interface for nodes that carry a source position.
 * Used by the disambiguation pass to recover the physical line backing a statement
 * and to stamp that position onto a reparsed replacement.
 */
public interface SourceLocatable {

    /**
     * Returns where this node starts in the original source.
     *
     * @return The source position, never null.
     */
    SourcePosition position();
}
