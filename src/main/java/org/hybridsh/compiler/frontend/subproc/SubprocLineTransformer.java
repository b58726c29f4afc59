package org.hybridsh.compiler.frontend.subproc;

/**
 * Pure text transform turning a raw source line into a candidate subprocess-syntax line.
 */
@FunctionalInterface
public interface SubprocLineTransformer {

    /**
     * @param rawLine The line as written by the user.
     * @return The line to feed to a {@link SubprocParser}.
     */
    String toSubprocSyntax(String rawLine);
}
