package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code except type as name: body}.
 *
 * @param type     The caught exception expression, null for a bare {@code except}.
 * @param name     The bound name, or null.
 * @param body     The handler body.
 * @param position Where the {@code except} starts.
 */
public record ExceptHandler(Expression type, String name, Block body, SourcePosition position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.EXCEPT_HANDLER;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(type, body);
    }
}
