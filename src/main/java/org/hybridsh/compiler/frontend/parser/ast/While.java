package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code while test: body else: orElse}.
 */
public record While(Expression test, Block body, Block orElse, SourcePosition position) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.WHILE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, body, orElse);
    }

    @Override
    public While withPosition(SourcePosition position) {
        return new While(test, body, orElse, position);
    }
}
