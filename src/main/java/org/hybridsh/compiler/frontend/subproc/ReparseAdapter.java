package org.hybridsh.compiler.frontend.subproc;

import org.hybridsh.compiler.frontend.parser.ast.ExpressionStatement;
import org.hybridsh.compiler.frontend.parser.ast.Module;
import org.hybridsh.compiler.frontend.parser.ast.SourcePosition;
import org.hybridsh.compiler.frontend.parser.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Reinterprets a single expression statement by re-parsing its physical source line under
 * the subprocess grammar.
 * <p>
 * Only the line at the statement's starting line number is considered, so a failure cannot
 * affect sibling statements and a success replaces exactly one statement. Parse failures are
 * reported as {@link ReparseResult.NoReplacement}, never thrown.
 */
public class ReparseAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(ReparseAdapter.class);

    private final SourceLineIndex sourceLines;
    private final SubprocParser parser;
    private final SubprocLineTransformer transformer;

    /**
     * @param sourceLines The source the tree was parsed from.
     * @param parser      Parser for the subprocess grammar.
     * @param transformer Converts a raw line into subprocess syntax.
     */
    public ReparseAdapter(SourceLineIndex sourceLines, SubprocParser parser, SubprocLineTransformer transformer) {
        this.sourceLines = Objects.requireNonNull(sourceLines, "sourceLines");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
    }

    /**
     * Attempts the reinterpretation.
     *
     * @param node The ambiguous statement.
     * @return The replacement positioned where {@code node} was, or the reason there is none.
     */
    public ReparseResult reparse(ExpressionStatement node) {
        SourcePosition position = node.position();
        Optional<String> rawLine = sourceLines.line(position.line());
        if (rawLine.isEmpty()) {
            return new ReparseResult.NoReplacement("no source line " + position.line()
                    + " (source has " + sourceLines.lineCount() + " lines)");
        }

        String candidate = transformer.toSubprocSyntax(rawLine.get());
        Module parsed;
        try {
            parsed = parser.parse(candidate);
        } catch (SubprocSyntaxException e) {
            LOG.debug("Subprocess reparse of line {} failed for '{}': {}", position.line(), candidate, e.getMessage());
            return new ReparseResult.NoReplacement(e.getMessage());
        }

        if (parsed == null || parsed.body().size() == 0) {
            return new ReparseResult.NoReplacement("parser produced no statement for '" + candidate + "'");
        }
        Statement first = parsed.body().get(0);
        return new ReparseResult.Replaced(first.withPosition(position));
    }
}
