package org.hybridsh.compiler.frontend.postprocess;

import org.hybridsh.compiler.frontend.parser.ast.SourcePosition;

/**
 * Per-statement record of a disambiguation run.
 *
 * @param position     Position of the expression statement.
 * @param leftmostName The head identifier of the statement, or null if it has none.
 * @param outcome      What happened to the statement.
 * @param detail       Failure reason for {@link Outcome#UNCHANGED_PARSE_FAILURE}, otherwise null.
 */
public record StatementOutcome(SourcePosition position, String leftmostName, Outcome outcome, String detail) {
}
