package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code return value}; {@code value} is null for a bare {@code return}.
 */
public record Return(Expression value, SourcePosition position) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(value);
    }

    @Override
    public Return withPosition(SourcePosition position) {
        return new Return(value, position);
    }
}
