package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Attribute access {@code value.attr}.
 *
 * @param value    The object expression.
 * @param attr     The accessed attribute name.
 * @param position Where the expression starts.
 */
public record Attribute(Expression value, String attr, SourcePosition position) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
