package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Starred expression {@code *value}, as used in unpacking targets.
 */
public record Starred(Expression value, SourcePosition position) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.STARRED;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
