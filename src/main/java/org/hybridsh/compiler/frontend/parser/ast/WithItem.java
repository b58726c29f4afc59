package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One context manager of a {@code with} statement.
 *
 * @param contextExpr  The context manager expression.
 * @param optionalVars The {@code as} target, or null.
 * @param position     Where the item starts.
 */
public record WithItem(Expression contextExpr, Expression optionalVars, SourcePosition position) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.WITH_ITEM;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(contextExpr, optionalVars);
    }
}
