package com.docfusion.core.analysis;

import java.util.Objects;

/**
 * Module or package documentation read from an include file.
 *
 * <p>Include files are Markdown documents split by {@code # Module <name>} and
 * {@code # Package <name>} headings; the text below each heading documents the named element.
 *
 * @param scope whether the text documents a module or a package
 * @param name module or package name
 * @param text documentation text
 */
public record IncludedDocumentation(
    Scope scope,
    String name,
    String text
) {
    /**
     * Element an included text documents.
     */
    public enum Scope {
        MODULE,
        PACKAGE
    }

    /**
     * Compact constructor with validation.
     */
    public IncludedDocumentation {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(name, "name must not be null");
        text = text == null ? "" : text.strip();
    }
}
