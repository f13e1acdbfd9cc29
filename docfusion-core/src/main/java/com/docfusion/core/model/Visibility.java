package com.docfusion.core.model;

/**
 * Declared visibility of a documentable on one platform.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    INTERNAL,
    PACKAGE_PRIVATE,
    PRIVATE;

    /**
     * Returns true if the declaration is part of the published API surface.
     *
     * @return true for public and protected declarations
     */
    public boolean isPublicApi() {
        return this == PUBLIC || this == PROTECTED;
    }
}
