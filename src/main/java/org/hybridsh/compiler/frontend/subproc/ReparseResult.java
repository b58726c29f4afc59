package org.hybridsh.compiler.frontend.subproc;

import org.hybridsh.compiler.frontend.parser.ast.Statement;

/**
 * Outcome of trying to reinterpret one statement under the subprocess grammar.
 */
public sealed interface ReparseResult permits ReparseResult.Replaced, ReparseResult.NoReplacement {

    /**
     * The line parsed; {@code replacement} already carries the original statement's position.
     */
    record Replaced(Statement replacement) implements ReparseResult {
    }

    /**
     * The line could not be reinterpreted; the original statement stays.
     *
     * @param reason Human-readable cause, for logging and reports.
     */
    record NoReplacement(String reason) implements ReparseResult {
    }
}
