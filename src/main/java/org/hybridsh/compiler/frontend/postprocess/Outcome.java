package org.hybridsh.compiler.frontend.postprocess;

/**
 * What the disambiguation pass did with one expression statement.
 */
public enum Outcome {
    /** The leftmost name is bound, or the statement is already a subprocess call. */
    UNCHANGED,
    /** The statement was reparsed as a subprocess call and swapped in place. */
    REPLACED,
    /** Reinterpretation was attempted but the line did not parse; the expression stays. */
    UNCHANGED_PARSE_FAILURE
}
