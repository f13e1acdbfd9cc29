package com.docfusion.core.analysis;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.exception.AnalysisEnvironmentException;

/**
 * Builds analysis contexts for platform passes.
 *
 * <p>This is the seam to the source analysis collaborator: the pipeline only consumes the
 * resulting {@link AnalysisContext}s and never inspects how symbols were resolved.
 */
public interface AnalysisEnvironmentFactory {

    /**
     * Builds the analysis context of one pass.
     *
     * @param pass pass configuration (classpath, source roots, language and API version)
     * @param collector collector receiving analysis diagnostics
     * @return analysis context
     * @throws AnalysisEnvironmentException if the context cannot be built
     */
    AnalysisContext create(PassConfig pass, MessageCollector collector);
}
