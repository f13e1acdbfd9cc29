package com.docfusion.core;

/**
 * Outcome of a successful documentation run.
 *
 * @param analysisErrors whether any analysis reported an error diagnostic
 * @param warnings warnings logged during the run
 * @param errors errors logged during the run
 */
public record GenerationReport(
    boolean analysisErrors,
    int warnings,
    int errors
) {}
