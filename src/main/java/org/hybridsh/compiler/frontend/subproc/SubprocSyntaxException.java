package org.hybridsh.compiler.frontend.subproc;

/**
 * Thrown when a line cannot be parsed under the subprocess grammar.
 * <p>
 * This is a checked exception. Inside the disambiguation pass it is caught by
 * {@link ReparseAdapter} and downgraded to "no replacement": a failed
 * reinterpretation is an expected outcome for lines that are plain expressions.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try {
 *     Module parsed = parser.parse(line);
 *     ...
 * } catch (SubprocSyntaxException e) {
 *     log.debug("Keeping expression at {}: {}", position, e.getMessage());
 * }
 * }</pre>
 */
public class SubprocSyntaxException extends Exception {

    private final int line;
    private final int column;

    /**
     * Constructs a new exception.
     *
     * @param message the detail message describing the syntax problem
     * @param line    1-based line of the offending input, relative to the parsed text
     * @param column  0-based column of the offending character
     */
    public SubprocSyntaxException(String message, int line, int column) {
        super(message + " (at " + line + ":" + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
