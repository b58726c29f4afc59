package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code try: body except...: handlers else: orElse finally: finalBody}.
 */
public record TryExcept(Block body, List<ExceptHandler> handlers, Block orElse, Block finalBody,
                        SourcePosition position) implements Statement {

    public TryExcept {
        handlers = List.copyOf(handlers);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRY_EXCEPT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body, handlers, orElse, finalBody);
    }

    @Override
    public TryExcept withPosition(SourcePosition position) {
        return new TryExcept(body, handlers, orElse, finalBody, position);
    }
}
