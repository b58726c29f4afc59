package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code with a as x, b: body}.
 */
public record With(List<WithItem> items, Block body, SourcePosition position) implements Statement {

    public With {
        items = List.copyOf(items);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WITH;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(items, body);
    }

    @Override
    public With withPosition(SourcePosition position) {
        return new With(items, body, position);
    }
}
