package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Base interface for all nodes of the host syntax tree.
 */
public interface AstNode extends SourceLocatable {

    /**
     * @return The tag used for exhaustive dispatch over node variants.
     */
    NodeKind kind();

    /**
     * Returns the direct children of this node in source order.
     * Statement bodies are exposed as {@link Block} children so that passes can
     * replace statements in place.
     *
     * @return An unmodifiable list of children, empty for leaves.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
