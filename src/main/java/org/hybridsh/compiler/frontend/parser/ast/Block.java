package org.hybridsh.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, mutable sequence of statements forming a body (module, function, loop, ...).
 * <p>
 * Blocks are the only place where a statement can be swapped for another one, which is how
 * tree passes rewrite a statement without rebuilding its ancestors.
 *
 * @param statements The statements in source order. The list is owned by the block.
 * @param position   Where the body starts.
 */
public record Block(List<Statement> statements, SourcePosition position) implements AstNode {

    public Block {
        statements = new ArrayList<>(statements);
        Objects.requireNonNull(position, "position");
    }

    /**
     * Creates an empty block, e.g. for a missing {@code else} branch.
     */
    public static Block empty(SourcePosition position) {
        return new Block(List.of(), position);
    }

    public int size() {
        return statements.size();
    }

    public Statement get(int index) {
        return statements.get(index);
    }

    /**
     * Replaces the statement at the given slot.
     *
     * @param index       The slot to overwrite.
     * @param replacement The new statement.
     * @return The statement previously held by the slot.
     */
    public Statement replace(int index, Statement replacement) {
        return statements.set(index, Objects.requireNonNull(replacement, "replacement"));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(statements);
    }
}
