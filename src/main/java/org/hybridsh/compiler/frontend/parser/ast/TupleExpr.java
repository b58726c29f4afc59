package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Tuple display {@code a, b}. As an assignment target it denotes sequence unpacking.
 */
public record TupleExpr(List<Expression> elements, SourcePosition position) implements Expression {

    public TupleExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TUPLE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}
