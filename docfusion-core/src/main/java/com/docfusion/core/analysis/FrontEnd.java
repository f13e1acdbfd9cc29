package com.docfusion.core.analysis;

/**
 * Kind of analysis front end behind an {@link AnalysisContext}.
 */
public enum FrontEnd {
    /** Java sources parsed in-process. */
    JAVA_SOURCE,
    /** Symbols pre-analyzed by an external toolchain and exported as descriptors. */
    SYMBOL_DESCRIPTORS
}
