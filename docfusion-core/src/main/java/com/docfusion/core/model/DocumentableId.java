package com.docfusion.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Stable identity key of a documentable.
 *
 * <p>Two declarations analyzed on different platforms are "the same" declaration exactly when
 * their ids are equal. The merger relies on this to line up per-platform trees.
 *
 * @param path fully qualified dotted path (e.g. "com.example.Cache.get")
 * @param signature parenthesized parameter type list for callables (e.g. "(String,int)");
 *                  empty for everything else
 */
public record DocumentableId(
    String path,
    String signature
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentableId {
        Objects.requireNonNull(path, "path must not be null");
        if (signature == null) {
            signature = "";
        }
    }

    /**
     * Creates an id for a declaration that has no signature.
     *
     * @param path fully qualified path
     * @return id with an empty signature
     */
    public static DocumentableId of(String path) {
        return new DocumentableId(path, "");
    }

    /**
     * Creates the id of a direct child of this declaration.
     *
     * @param name simple name of the child
     * @param signature child signature, or empty
     * @return child id
     */
    public DocumentableId child(String name, String signature) {
        String childPath = path.isEmpty() ? name : path + "." + name;
        return new DocumentableId(childPath, signature);
    }

    /**
     * Formats a parameter type list as a callable signature.
     *
     * @param parameterTypes parameter types in declaration order
     * @return signature such as "(String,int)", or "()" for no parameters
     */
    public static String signatureOf(List<String> parameterTypes) {
        return "(" + String.join(",", parameterTypes) + ")";
    }

    @Override
    public String toString() {
        return path + signature;
    }
}
