package org.hybridsh.compiler.frontend.postprocess;

import com.typesafe.config.Config;

import org.hybridsh.compiler.frontend.subproc.UncapturedSubprocWrapper;

/**
 * Tuning knobs of the disambiguation pass, normally read from the
 * {@value #CONFIG_PATH} section of the application configuration.
 *
 * @param enabled                  When false the pass returns trees untouched.
 * @param bindFunctionParameters   Bind parameter names inside the function's own frame.
 * @param skipSubprocessStatements Leave statements that already hold a subprocess call alone.
 * @param subprocOpen              Opening marker used when wrapping a line for reparse.
 * @param subprocClose             Closing marker used when wrapping a line for reparse.
 */
public record DisambiguationOptions(
        boolean enabled,
        boolean bindFunctionParameters,
        boolean skipSubprocessStatements,
        String subprocOpen,
        String subprocClose
) {

    /** Location of the options in the application configuration. */
    public static final String CONFIG_PATH = "hybridsh.disambiguation";

    public static final boolean DEFAULT_ENABLED = true;
    public static final boolean DEFAULT_BIND_FUNCTION_PARAMETERS = true;
    public static final boolean DEFAULT_SKIP_SUBPROCESS_STATEMENTS = true;

    /**
     * @return Options with every setting at its default.
     */
    public static DisambiguationOptions defaults() {
        return new DisambiguationOptions(
                DEFAULT_ENABLED,
                DEFAULT_BIND_FUNCTION_PARAMETERS,
                DEFAULT_SKIP_SUBPROCESS_STATEMENTS,
                UncapturedSubprocWrapper.DEFAULT_OPEN,
                UncapturedSubprocWrapper.DEFAULT_CLOSE);
    }

    /**
     * Reads options from the {@value #CONFIG_PATH} section, using defaults for missing keys.
     *
     * @param config The application configuration (root, not the section).
     * @return The options.
     */
    public static DisambiguationOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults();
        }
        Config options = config.getConfig(CONFIG_PATH);
        return new DisambiguationOptions(
                options.hasPath("enabled") ? options.getBoolean("enabled") : DEFAULT_ENABLED,
                options.hasPath("bind-function-parameters")
                        ? options.getBoolean("bind-function-parameters") : DEFAULT_BIND_FUNCTION_PARAMETERS,
                options.hasPath("skip-subprocess-statements")
                        ? options.getBoolean("skip-subprocess-statements") : DEFAULT_SKIP_SUBPROCESS_STATEMENTS,
                options.hasPath("subproc.open") ? options.getString("subproc.open") : UncapturedSubprocWrapper.DEFAULT_OPEN,
                options.hasPath("subproc.close") ? options.getString("subproc.close") : UncapturedSubprocWrapper.DEFAULT_CLOSE
        );
    }
}
