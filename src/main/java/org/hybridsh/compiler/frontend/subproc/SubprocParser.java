package org.hybridsh.compiler.frontend.subproc;

import org.hybridsh.compiler.frontend.parser.ast.Module;

/**
 * Parses a single source line under the subprocess grammar.
 * Implementations must return a module whose first statement is the usable replacement.
 */
@FunctionalInterface
public interface SubprocParser {

    /**
     * @param line One line of source, already transformed into subprocess syntax.
     * @return The parsed program.
     * @throws SubprocSyntaxException if the line is not valid subprocess syntax.
     */
    Module parse(String line) throws SubprocSyntaxException;
}
