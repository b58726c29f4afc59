package org.hybridsh.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call expression {@code func(arguments...)}.
 *
 * @param func      The callee expression.
 * @param arguments Positional arguments in source order.
 * @param position  Where the expression starts.
 */
public record Call(Expression func, List<Expression> arguments, SourcePosition position) implements Expression {

    public Call {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(arguments.size() + 1);
        children.add(func);
        children.addAll(arguments);
        return List.copyOf(children);
    }
}
