package com.docfusion.core.analysis;

/**
 * Severity of an analysis diagnostic.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
