package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Subscription {@code value[index]}.
 */
public record Subscript(Expression value, Expression index, SourcePosition position) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.SUBSCRIPT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value, index);
    }
}
