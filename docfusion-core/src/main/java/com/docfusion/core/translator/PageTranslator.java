package com.docfusion.core.translator;

import com.docfusion.core.model.Module;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;

/**
 * Converts the final documentation model into a page tree.
 *
 * <p>Registered on {@link com.docfusion.core.plugin.CoreExtensions#PAGE_TRANSLATOR}.
 * Must be deterministic: translating equal modules yields equal page trees.
 */
@FunctionalInterface
public interface PageTranslator {

    /**
     * Builds the page tree of a module.
     *
     * @param module merged and transformed module
     * @param context run context
     * @return root of the page tree
     */
    RootPageNode translate(Module module, DocContext context);
}
