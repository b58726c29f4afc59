package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Augmented assignment {@code target op= value}. It rebinds an existing name, so it
 * introduces nothing new into scope.
 */
public record AugmentedAssignment(Expression target, String operator, Expression value, SourcePosition position)
        implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.AUGMENTED_ASSIGNMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public AugmentedAssignment withPosition(SourcePosition position) {
        return new AugmentedAssignment(target, operator, value, position);
    }
}
