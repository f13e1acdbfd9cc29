package com.docfusion.core;

/**
 * Stages of a documentation run, in execution order.
 *
 * <p>The driver logs {@link #progressMessage()} through
 * {@link com.docfusion.core.logging.DocLogger#progress(String)} when a stage starts, so the
 * stage at which a run failed is the last progress line logged.
 */
public enum PipelineStage {
    SETUP_ANALYSIS("Setting up analysis environments"),
    INITIALIZE_PLUGINS("Initializing plugins"),
    CREATE_MODELS("Creating documentation models"),
    MERGE_MODELS("Merging documentation models"),
    TRANSFORM_MODEL("Transforming documentation model"),
    CREATE_PAGES("Creating pages"),
    TRANSFORM_PAGES("Transforming pages"),
    RENDER("Rendering");

    private final String progressMessage;

    PipelineStage(String progressMessage) {
        this.progressMessage = progressMessage;
    }

    /**
     * Returns the progress message logged when this stage starts.
     *
     * @return progress message
     */
    public String progressMessage() {
        return progressMessage;
    }
}
