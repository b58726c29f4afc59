package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Assignment {@code t1 = t2 = value}. Targets may be names, attributes, subscripts or
 * tuple/list unpacking patterns.
 */
public record Assignment(List<Expression> targets, Expression value, SourcePosition position) implements Statement {

    public Assignment {
        targets = List.copyOf(targets);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGNMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(targets, value);
    }

    @Override
    public Assignment withPosition(SourcePosition position) {
        return new Assignment(targets, value, position);
    }
}
