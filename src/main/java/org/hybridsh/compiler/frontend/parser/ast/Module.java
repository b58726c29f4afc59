package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Root of a parsed program.
 *
 * @param body     Top-level statements.
 * @param position Normally {@code 1:0}.
 */
public record Module(Block body, SourcePosition position) implements Statement {

    public Module(Block body) {
        this(body, new SourcePosition(1, 0));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODULE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }

    @Override
    public Module withPosition(SourcePosition position) {
        return new Module(body, position);
    }
}
