package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code global a, b}.
 */
public record GlobalDecl(List<String> names, SourcePosition position) implements Statement {

    public GlobalDecl {
        names = List.copyOf(names);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GLOBAL_DECL;
    }

    @Override
    public GlobalDecl withPosition(SourcePosition position) {
        return new GlobalDecl(names, position);
    }
}
