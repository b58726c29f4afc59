package org.hybridsh.compiler.frontend.parser.ast;

/**
 * One imported name, optionally renamed: {@code name as asName}.
 *
 * @param name     The imported (possibly dotted) name.
 * @param asName   The alias, or null.
 * @param position Where the name starts.
 */
public record ImportAlias(String name, String asName, SourcePosition position) implements AstNode {

    /**
     * Returns the identifier this import introduces into the importing scope: the alias if
     * present, otherwise the first segment of a dotted name ({@code import os.path} binds {@code os}).
     */
    public String boundName() {
        if (asName != null) {
            return asName;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_ALIAS;
    }
}
