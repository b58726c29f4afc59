package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code del t1, t2}.
 */
public record Delete(List<Expression> targets, SourcePosition position) implements Statement {

    public Delete {
        targets = List.copyOf(targets);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DELETE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(targets);
    }

    @Override
    public Delete withPosition(SourcePosition position) {
        return new Delete(targets, position);
    }
}
