package org.hybridsh.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * A bare identifier reference, e.g. {@code ls} or {@code x}.
 *
 * @param id       The identifier text.
 * @param position Where the identifier starts.
 */
public record Name(String id, SourcePosition position) implements Expression {

    public Name {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NAME;
    }
}
