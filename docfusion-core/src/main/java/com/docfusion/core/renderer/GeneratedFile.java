package com.docfusion.core.renderer;

import java.util.Objects;

/**
 * Represents a rendered file to be written.
 *
 * @param relativePath path relative to the output directory (e.g., "com/example/Cache.md")
 * @param content file content
 */
public record GeneratedFile(
    String relativePath,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
