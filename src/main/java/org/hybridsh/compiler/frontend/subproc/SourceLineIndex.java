package org.hybridsh.compiler.frontend.subproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The original source split into physical lines, addressed by 1-based line number.
 * Accepts {@code \n}, {@code \r\n} and {@code \r} as terminators; a trailing terminator
 * does not produce an extra empty line.
 */
public final class SourceLineIndex {

    private final List<String> lines;

    private SourceLineIndex(List<String> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    /**
     * Splits the given source text.
     *
     * @param sourceText The exact text the tree was parsed from.
     * @return The index.
     */
    public static SourceLineIndex of(String sourceText) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        int n = sourceText.length();
        while (i < n) {
            char c = sourceText.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(sourceText.substring(start, i));
                if (c == '\r' && i + 1 < n && sourceText.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
            i++;
        }
        if (start < n) {
            lines.add(sourceText.substring(start));
        }
        return new SourceLineIndex(lines);
    }

    /**
     * @param lineNumber 1-based line number.
     * @return The line without its terminator, or empty if out of range.
     */
    public Optional<String> line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(lineNumber - 1));
    }

    public int lineCount() {
        return lines.size();
    }
}
