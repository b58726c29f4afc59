package org.hybridsh.compiler.frontend.parser.ast;

/**
 * Closed enumeration of the node kinds the frontend passes dispatch on.
 * Every {@link AstNode} reports exactly one kind, so a switch over this enum
 * covers the whole tree model.
 */
public enum NodeKind {
    // Expressions
    NAME,
    ATTRIBUTE,
    SUBSCRIPT,
    CALL,
    BINARY_OP,
    COMPARISON,
    STARRED,
    TUPLE,
    LIST,
    CONSTANT,
    SUBPROC_CALL,

    // Statements
    MODULE,
    EXPRESSION_STATEMENT,
    ASSIGNMENT,
    AUGMENTED_ASSIGNMENT,
    IMPORT,
    IMPORT_FROM,
    WITH,
    FOR,
    WHILE,
    IF,
    FUNCTION_DEF,
    CLASS_DEF,
    RETURN,
    DELETE,
    TRY_EXCEPT,
    GLOBAL_DECL,

    // Structural helpers
    BLOCK,
    IMPORT_ALIAS,
    WITH_ITEM,
    EXCEPT_HANDLER;

    /**
     * @return true for kinds that may stand as a statement inside a {@link Block}.
     */
    public boolean isStatement() {
        return ordinal() >= MODULE.ordinal() && ordinal() <= GLOBAL_DECL.ordinal();
    }
}
