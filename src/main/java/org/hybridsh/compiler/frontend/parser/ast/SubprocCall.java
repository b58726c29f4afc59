package org.hybridsh.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A subprocess invocation produced by the subprocess grammar, e.g. {@code $[ls -la]}.
 *
 * @param arguments The command word followed by its arguments, quotes already removed.
 * @param captured  True for {@code $(...)}, whose output is captured as a value;
 *                  false for {@code $[...]}, which streams to the terminal.
 * @param position  Where the invocation starts.
 */
public record SubprocCall(List<String> arguments, boolean captured, SourcePosition position)
        implements Expression {

    public SubprocCall {
        arguments = List.copyOf(arguments);
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("A subprocess call needs at least a command word.");
        }
    }

    /**
     * @return The command word.
     */
    public String command() {
        return arguments.get(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUBPROC_CALL;
    }
}
