package com.docfusion.core.transformer;

import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;

/**
 * One step of the page transform chain: navigation, search indices, extra sections and other
 * concerns the page translator does not know about.
 *
 * <p>Registered on {@link com.docfusion.core.plugin.CoreExtensions#PAGE_TRANSFORMER} and
 * applied in registration order.
 */
@FunctionalInterface
public interface PageTransformer {

    /**
     * Transforms a page tree.
     *
     * @param root current page tree
     * @param context run context
     * @return transformed page tree
     */
    RootPageNode transform(RootPageNode root, DocContext context);
}
