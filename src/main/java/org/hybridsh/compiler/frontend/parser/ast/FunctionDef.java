package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A function definition.
 *
 * @param name       The function name, bound in the enclosing scope.
 * @param parameters Parameter names, bound in the function's own scope.
 * @param decorators Decorator expressions in source order.
 * @param body       The function body.
 * @param position   Where the {@code def} starts.
 */
public record FunctionDef(String name, List<String> parameters, List<Expression> decorators, Block body,
                          SourcePosition position) implements Statement {

    public FunctionDef {
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(decorators, body);
    }

    @Override
    public FunctionDef withPosition(SourcePosition position) {
        return new FunctionDef(name, parameters, decorators, body, position);
    }
}
