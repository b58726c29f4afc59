package org.hybridsh.compiler.frontend.semantics;

import org.hybridsh.compiler.frontend.parser.ast.Attribute;
import org.hybridsh.compiler.frontend.parser.ast.AstNode;
import org.hybridsh.compiler.frontend.parser.ast.BinaryOp;
import org.hybridsh.compiler.frontend.parser.ast.Call;
import org.hybridsh.compiler.frontend.parser.ast.Comparison;
import org.hybridsh.compiler.frontend.parser.ast.ExpressionStatement;
import org.hybridsh.compiler.frontend.parser.ast.Name;
import org.hybridsh.compiler.frontend.parser.ast.Starred;
import org.hybridsh.compiler.frontend.parser.ast.Subscript;

import java.util.Optional;

/**
 * Finds the identifier that would be looked up first if a node were evaluated.
 * <p>
 * {@code ls -la} yields {@code ls}, {@code os.path.join(a, b)} yields {@code os},
 * {@code x[0] < y} yields {@code x}. Literals and displays yield nothing.
 */
public final class LeftmostNameResolver {

    private LeftmostNameResolver() {
    }

    /**
     * Resolves the leftmost name of a node. Never mutates the node.
     *
     * @param node The node to inspect, may be null.
     * @return The head identifier, or empty if the node has none.
     */
    public static Optional<String> resolve(AstNode node) {
        if (node == null) return Optional.empty();
        return switch (node.kind()) {
            case NAME -> Optional.of(((Name) node).id());
            case BINARY_OP -> resolve(((BinaryOp) node).left());
            case COMPARISON -> resolve(((Comparison) node).left());
            case ATTRIBUTE -> resolve(((Attribute) node).value());
            case SUBSCRIPT -> resolve(((Subscript) node).value());
            case STARRED -> resolve(((Starred) node).value());
            case EXPRESSION_STATEMENT -> resolve(((ExpressionStatement) node).value());
            case CALL -> resolve(((Call) node).func());
            default -> Optional.empty();
        };
    }
}
