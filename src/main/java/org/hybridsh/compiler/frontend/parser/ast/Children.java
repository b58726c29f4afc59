package org.hybridsh.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Helper for assembling {@link AstNode#getChildren()} lists from mixed fields.
 */
final class Children {

    private Children() {
    }

    /**
     * Flattens nodes and node collections into one unmodifiable list, in argument order.
     * Null entries (absent optional fields) are skipped.
     */
    static List<AstNode> of(Object... parts) {
        List<AstNode> children = new ArrayList<>();
        for (Object part : parts) {
            if (part == null) continue;
            if (part instanceof AstNode node) {
                children.add(node);
            } else if (part instanceof Collection<?> nodes) {
                for (Object n : nodes) {
                    if (n != null) children.add((AstNode) n);
                }
            } else {
                throw new IllegalArgumentException("Not a node or node collection: " + part.getClass().getName());
            }
        }
        return List.copyOf(children);
    }
}
