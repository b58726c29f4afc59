package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A class definition.
 *
 * @param name       The class name, bound in the enclosing scope.
 * @param bases      Base class expressions.
 * @param decorators Decorator expressions in source order.
 * @param body       The class body.
 * @param position   Where the {@code class} keyword starts.
 */
public record ClassDef(String name, List<Expression> bases, List<Expression> decorators, Block body,
                       SourcePosition position) implements Statement {

    public ClassDef {
        bases = List.copyOf(bases);
        decorators = List.copyOf(decorators);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLASS_DEF;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(bases, decorators, body);
    }

    @Override
    public ClassDef withPosition(SourcePosition position) {
        return new ClassDef(name, bases, decorators, body, position);
    }
}
