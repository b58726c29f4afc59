package org.hybridsh.compiler.frontend.subproc;

import java.util.Objects;

/**
 * Wraps a line in an uncaptured subprocess: {@code ls -la} becomes {@code $[ls -la]}.
 * Leading indentation stays outside the wrapper, so {@code "    make all"} becomes
 * {@code "    $[make all]"}. Blank lines are returned unchanged.
 */
public class UncapturedSubprocWrapper implements SubprocLineTransformer {

    /** Opening marker of an uncaptured subprocess. */
    public static final String DEFAULT_OPEN = "$[";

    /** Closing marker of an uncaptured subprocess. */
    public static final String DEFAULT_CLOSE = "]";

    private final String open;
    private final String close;

    public UncapturedSubprocWrapper() {
        this(DEFAULT_OPEN, DEFAULT_CLOSE);
    }

    /**
     * @param open  Marker inserted before the first token.
     * @param close Marker appended after the last non-blank character.
     */
    public UncapturedSubprocWrapper(String open, String close) {
        this.open = Objects.requireNonNull(open, "open");
        this.close = Objects.requireNonNull(close, "close");
    }

    @Override
    public String toSubprocSyntax(String rawLine) {
        int start = 0;
        while (start < rawLine.length() && Character.isWhitespace(rawLine.charAt(start))) {
            start++;
        }
        if (start == rawLine.length()) {
            return rawLine;
        }
        int end = rawLine.length();
        while (end > start && Character.isWhitespace(rawLine.charAt(end - 1))) {
            end--;
        }
        return rawLine.substring(0, start) + open + rawLine.substring(start, end) + close;
    }
}
