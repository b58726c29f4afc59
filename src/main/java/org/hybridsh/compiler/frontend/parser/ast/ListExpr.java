package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * List display {@code [a, b]}. As an assignment target it denotes sequence unpacking.
 */
public record ListExpr(List<Expression> elements, SourcePosition position) implements Expression {

    public ListExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}
