package com.docfusion.core.merger;

import com.docfusion.core.model.Module;
import com.docfusion.core.plugin.DocContext;

import java.util.List;

/**
 * Combines per-platform modules into one cross-platform module.
 *
 * <p>Registered on {@link com.docfusion.core.plugin.CoreExtensions#DOCUMENTABLE_MERGER}.
 * Plugins may replace the default algorithm ({@link DefaultDocumentableMerger}) through
 * {@link com.docfusion.core.plugin.ExtensionRegistry.Builder#override}.
 */
@FunctionalInterface
public interface DocumentableMerger {

    /**
     * Merges modules.
     *
     * @param modules per-platform modules, in translation order
     * @param context run context
     * @return merged module
     * @throws com.docfusion.core.exception.ConfigurationException if {@code modules} is empty
     */
    Module merge(List<Module> modules, DocContext context);
}
