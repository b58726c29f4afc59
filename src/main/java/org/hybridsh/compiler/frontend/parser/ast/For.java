package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code for target in iter: body else: orElse}.
 */
public record For(Expression target, Expression iter, Block body, Block orElse, SourcePosition position)
        implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(target, iter, body, orElse);
    }

    @Override
    public For withPosition(SourcePosition position) {
        return new For(target, iter, body, orElse, position);
    }
}
