package org.hybridsh.compiler.frontend.parser.ast;

/**
 * A literal value: number, string, boolean or {@code None}.
 *
 * @param value    The literal, {@code null} for {@code None}.
 * @param position Where the literal starts.
 */
public record Constant(Object value, SourcePosition position) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }
}
