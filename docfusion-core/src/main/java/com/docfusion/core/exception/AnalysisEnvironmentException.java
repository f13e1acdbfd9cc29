package com.docfusion.core.exception;

/**
 * Raised by an analysis environment that cannot be built for a platform pass,
 * for example because a classpath entry does not exist.
 */
public class AnalysisEnvironmentException extends DocFusionException {

    public AnalysisEnvironmentException(String message) {
        super(message);
    }

    public AnalysisEnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
