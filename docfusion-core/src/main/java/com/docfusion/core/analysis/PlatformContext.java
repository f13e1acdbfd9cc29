package com.docfusion.core.analysis;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.PlatformData;

import java.util.Objects;

/**
 * Everything known about one platform pass during a run.
 *
 * @param platformData platform identity
 * @param pass pass configuration
 * @param analysis analysis handle
 */
public record PlatformContext(
    PlatformData platformData,
    PassConfig pass,
    AnalysisContext analysis
) {
    /**
     * Compact constructor with validation.
     */
    public PlatformContext {
        Objects.requireNonNull(platformData, "platformData must not be null");
        Objects.requireNonNull(pass, "pass must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
    }
}
