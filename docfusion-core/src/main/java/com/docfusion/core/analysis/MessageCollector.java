package com.docfusion.core.analysis;

import com.docfusion.core.model.SourceLocation;

/**
 * Receives diagnostics emitted by an analysis environment.
 *
 * <p>Diagnostics never stop the pipeline. Whether an error-severity diagnostic was seen is
 * surfaced at the end of the run so callers can decide their own pass/fail policy.
 */
public interface MessageCollector {

    /**
     * Records a diagnostic.
     *
     * @param severity diagnostic severity
     * @param message diagnostic text
     * @param location source location, or {@code null} if not tied to a location
     */
    void report(Severity severity, String message, SourceLocation location);

    /**
     * Returns true if any {@link Severity#ERROR} diagnostic was reported since the last
     * {@link #clear()}.
     *
     * @return true if errors were seen
     */
    boolean hasErrors();

    /**
     * Forgets previously seen errors.
     */
    void clear();
}
