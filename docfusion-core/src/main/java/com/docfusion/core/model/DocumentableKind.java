package com.docfusion.core.model;

/**
 * Closed set of program elements a {@link Documentable} can represent.
 */
public enum DocumentableKind {
    MODULE,
    PACKAGE,
    CLASS,
    INTERFACE,
    ENUM,
    ENUM_ENTRY,
    ANNOTATION,
    RECORD,
    OBJECT,
    FUNCTION,
    CONSTRUCTOR,
    PROPERTY,
    TYPE_ALIAS;

    /**
     * Returns true for kinds that get a page of their own (classifiers).
     *
     * @return true if this kind is a type declaration
     */
    public boolean isClassifier() {
        return switch (this) {
            case CLASS, INTERFACE, ENUM, ANNOTATION, RECORD, OBJECT -> true;
            default -> false;
        };
    }

    /**
     * Returns true for kinds whose identity includes a parameter signature.
     *
     * @return true for functions and constructors
     */
    public boolean isCallable() {
        return this == FUNCTION || this == CONSTRUCTOR;
    }
}
