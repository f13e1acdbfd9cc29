package com.docfusion.cli;

/**
 * Process exit codes of the CLI.
 */
public final class ExitCodes {

    public static final int OK = 0;
    /** A stage failed while running. */
    public static final int STAGE_FAILURE = 1;
    /** The configuration or plugin setup is invalid. */
    public static final int CONFIGURATION_ERROR = 2;
    /** Analysis reported errors and {@code failOnAnalysisError} is set. */
    public static final int ANALYSIS_ERRORS = 3;

    private ExitCodes() {
        // Constants class
    }
}
