package com.docfusion.core.model;

import java.util.Objects;

/**
 * Position of a declaration in its source file.
 *
 * @param path source file path, as given by the analysis environment
 * @param line 1-based line number, or 0 when unknown
 */
public record SourceLocation(
    String path,
    int line
) {
    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        Objects.requireNonNull(path, "path must not be null");
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative: " + line);
        }
    }

    @Override
    public String toString() {
        return line > 0 ? path + ":" + line : path;
    }
}
