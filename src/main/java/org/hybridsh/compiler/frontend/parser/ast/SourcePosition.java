package org.hybridsh.compiler.frontend.parser.ast;

/**
 * Location of a node in the source it was parsed from.
 *
 * @param line   1-based line number.
 * @param column 0-based column offset.
 */
public record SourcePosition(int line, int column) {

    /** Position used for synthetic nodes that have no source backing. */
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
