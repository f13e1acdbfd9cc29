package com.docfusion.core.plugin;

/**
 * How many implementations an extension point takes.
 */
public enum Cardinality {
    /** Exactly one implementation must be registered. */
    SINGLE,
    /** Any number of implementations, applied in order. */
    MULTI
}
