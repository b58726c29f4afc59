package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code from module import a, b as c}.
 *
 * @param module   The source module, null for a purely relative import.
 * @param names    The imported members.
 * @param level    Number of leading dots of a relative import, 0 when absolute.
 * @param position Where the statement starts.
 */
public record ImportFrom(String module, List<ImportAlias> names, int level, SourcePosition position)
        implements Statement {

    public ImportFrom {
        names = List.copyOf(names);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_FROM;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(names);
    }

    @Override
    public ImportFrom withPosition(SourcePosition position) {
        return new ImportFrom(module, names, level, position);
    }
}
