package com.docfusion.core.logging;

/**
 * Logger the pipeline reports progress and diagnostics through.
 *
 * <p>The driver calls {@link #progress(String)} once per stage, in stage order, and
 * {@link #report()} once after rendering. Implementations must be safe to call from the
 * parallel translation stage.
 */
public interface DocLogger {

    /**
     * Logs the start of a pipeline stage.
     *
     * @param message progress message
     */
    void progress(String message);

    void debug(String message);

    void info(String message);

    /**
     * Logs a warning and counts it towards {@link #warningsCount()}.
     *
     * @param message warning text
     */
    void warn(String message);

    /**
     * Logs an error and counts it towards {@link #errorsCount()}.
     *
     * @param message error text
     */
    void error(String message);

    int warningsCount();

    int errorsCount();

    /**
     * Surfaces the accumulated diagnostics at the end of a run.
     */
    void report();
}
