package org.hybridsh.compiler.frontend.parser.ast;

/**
 * Renders a tree as an indented dump, one node per line: {@code KIND [line:col] detail}.
 * Used for trace logging and in tests to compare shapes.
 */
public final class AstPrinter {

    private static final String INDENT = "  ";

    private AstPrinter() {
    }

    /**
     * Dumps the given subtree.
     *
     * @param root The node to start from.
     * @return The multi-line dump, each line terminated by {@code \n}.
     */
    public static String print(AstNode root) {
        StringBuilder out = new StringBuilder();
        printRec(root, 0, out);
        return out.toString();
    }

    private static void printRec(AstNode node, int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth))
                .append(node.kind().name())
                .append(" [").append(node.position()).append(']');
        String detail = detailFor(node);
        if (!detail.isEmpty()) {
            out.append(' ').append(detail);
        }
        out.append('\n');
        for (AstNode child : node.getChildren()) {
            printRec(child, depth + 1, out);
        }
    }

    private static String detailFor(AstNode node) {
        return switch (node.kind()) {
            case NAME -> ((Name) node).id();
            case ATTRIBUTE -> "." + ((Attribute) node).attr();
            case BINARY_OP -> ((BinaryOp) node).operator();
            case COMPARISON -> String.join(" ", ((Comparison) node).operators());
            case CONSTANT -> String.valueOf(((Constant) node).value());
            case SUBPROC_CALL -> {
                SubprocCall call = (SubprocCall) node;
                yield (call.captured() ? "$(" : "$[") + String.join(" ", call.arguments())
                        + (call.captured() ? ")" : "]");
            }
            case AUGMENTED_ASSIGNMENT -> ((AugmentedAssignment) node).operator() + "=";
            case IMPORT_ALIAS -> {
                ImportAlias alias = (ImportAlias) node;
                yield alias.asName() == null ? alias.name() : alias.name() + " as " + alias.asName();
            }
            case IMPORT_FROM -> ".".repeat(((ImportFrom) node).level())
                    + (((ImportFrom) node).module() == null ? "" : ((ImportFrom) node).module());
            case FUNCTION_DEF -> {
                FunctionDef def = (FunctionDef) node;
                yield def.name() + "(" + String.join(", ", def.parameters()) + ")";
            }
            case CLASS_DEF -> ((ClassDef) node).name();
            case GLOBAL_DECL -> String.join(", ", ((GlobalDecl) node).names());
            case EXCEPT_HANDLER -> ((ExceptHandler) node).name() == null ? "" : "as " + ((ExceptHandler) node).name();
            default -> "";
        };
    }
}
