package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code if test: body else: orElse}. An {@code elif} chain nests another {@code If} in {@code orElse}.
 */
public record If(Expression test, Block body, Block orElse, SourcePosition position) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, body, orElse);
    }

    @Override
    public If withPosition(SourcePosition position) {
        return new If(test, body, orElse, position);
    }
}
