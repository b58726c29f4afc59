package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An expression evaluated for its side effects, on a line of its own.
 * This is the ambiguous shape: {@code ls -la} parses as one.
 *
 * @param value    The wrapped expression.
 * @param position Where the statement starts.
 */
public record ExpressionStatement(Expression value, SourcePosition position) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public ExpressionStatement withPosition(SourcePosition position) {
        return new ExpressionStatement(value, position);
    }
}
