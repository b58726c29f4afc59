package org.hybridsh.compiler.frontend.postprocess;

import org.hybridsh.compiler.frontend.parser.ast.Module;

import java.util.List;
import java.util.Optional;

/**
 * Result of a disambiguation run: the tree (same object as passed in) and one outcome per
 * expression statement, in visiting order.
 */
public record DisambiguationReport(Module tree, List<StatementOutcome> outcomes) {

    public DisambiguationReport {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * @return How many statements ended with the given outcome.
     */
    public long count(Outcome outcome) {
        return outcomes.stream().filter(o -> o.outcome() == outcome).count();
    }

    /**
     * @return The outcome recorded for the statement starting on the given line, if any.
     */
    public Optional<StatementOutcome> forLine(int line) {
        return outcomes.stream().filter(o -> o.position().line() == line).findFirst();
    }
}
