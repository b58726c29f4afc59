package org.hybridsh.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Chained comparison {@code left op1 c1 op2 c2 ...}.
 *
 * @param left        First operand.
 * @param operators   Operator symbols, one per comparator.
 * @param comparators Remaining operands.
 * @param position    Where the expression starts.
 */
public record Comparison(Expression left, List<String> operators, List<Expression> comparators,
                         SourcePosition position) implements Expression {

    public Comparison {
        operators = List.copyOf(operators);
        comparators = List.copyOf(comparators);
        if (operators.size() != comparators.size()) {
            throw new IllegalArgumentException("Each comparator needs exactly one operator.");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPARISON;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(comparators.size() + 1);
        children.add(left);
        children.addAll(comparators);
        return List.copyOf(children);
    }
}
