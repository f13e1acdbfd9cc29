package com.docfusion.core.exception;

import com.docfusion.core.PipelineStage;

import java.util.Objects;

/**
 * Fatal fault inside a pipeline stage (translator, merger, transformer, page translator or
 * renderer). Later stages never run once this is raised.
 */
public class StageFailureException extends DocFusionException {

    private final PipelineStage stage;

    public StageFailureException(PipelineStage stage, Throwable cause) {
        super("Stage '" + stage.progressMessage() + "' failed: " + describe(cause), cause);
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
    }

    public StageFailureException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
    }

    /**
     * Returns the stage that failed.
     *
     * @return failed stage
     */
    public PipelineStage getStage() {
        return stage;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
