package com.docfusion.core.pages;

/**
 * Kinds of content blocks a page is assembled from.
 */
public enum ContentKind {
    /** Heading; the block text is the heading title. */
    HEADER,
    /** Documentation prose. */
    TEXT,
    /** Declaration signature line. */
    SIGNATURE,
    /** Named group of nested blocks (e.g. "Functions"). */
    SECTION,
    /** Hyperlink; the text holds the target URL. */
    LINK,
    /** List of platforms a declaration is available on. */
    PLATFORMS,
    /** Deprecation notice. */
    DEPRECATION,
    /** Qualified name of a referenced type; a nested {@code LINK} child holds its URL once resolved. */
    TYPE_REFERENCE
}
