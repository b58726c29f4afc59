package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Binary operation {@code left op right}. Note that {@code ls -la} parses as
 * {@code ls - la} in expression mode, which is the main reason this pass exists.
 *
 * @param left     Left operand.
 * @param operator Operator symbol as written, e.g. {@code "-"}.
 * @param right    Right operand.
 * @param position Where the expression starts.
 */
public record BinaryOp(Expression left, String operator, Expression right, SourcePosition position)
        implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
