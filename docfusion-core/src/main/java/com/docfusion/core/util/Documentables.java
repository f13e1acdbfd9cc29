package com.docfusion.core.util;

import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.Module;

import java.util.function.BiConsumer;

/**
 * Traversal helpers for documentation trees.
 */
public final class Documentables {

    private Documentables() {
        // Utility class
    }

    /**
     * Visits every documentable of a module depth-first, parents before children, together
     * with the name of the package it belongs to.
     *
     * @param module module to walk
     * @param visitor receives the package name and the documentable
     */
    public static void walk(Module module, BiConsumer<String, Documentable> visitor) {
        for (Documentable pkg : module.packages()) {
            walk(pkg, pkg.id().path(), visitor);
        }
    }

    private static void walk(Documentable documentable, String packageName,
                             BiConsumer<String, Documentable> visitor) {
        visitor.accept(packageName, documentable);
        for (Documentable child : documentable.children()) {
            walk(child, packageName, visitor);
        }
    }
}
