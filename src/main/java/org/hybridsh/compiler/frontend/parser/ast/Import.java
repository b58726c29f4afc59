package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code import a, b.c as d}.
 */
public record Import(List<ImportAlias> names, SourcePosition position) implements Statement {

    public Import {
        names = List.copyOf(names);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(names);
    }

    @Override
    public Import withPosition(SourcePosition position) {
        return new Import(names, position);
    }
}
