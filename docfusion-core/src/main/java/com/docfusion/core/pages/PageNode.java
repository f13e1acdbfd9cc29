package com.docfusion.core.pages;

import java.util.List;

/**
 * Node of the output page tree consumed by a renderer.
 *
 * <p>Page nodes are immutable. Transformers that need to change the tree build a new node
 * through {@link #withChildren(List)} instead of mutating children in place.
 *
 * @see RootPageNode
 * @see ContentPage
 */
public interface PageNode {

    /**
     * Returns the display name of this page.
     *
     * @return display name
     */
    String name();

    /**
     * Returns the owned child pages in display order.
     *
     * @return child pages
     */
    List<PageNode> children();

    /**
     * Returns a copy of this page with the given children.
     *
     * @param children replacement children
     * @return new page of the same type
     */
    PageNode withChildren(List<PageNode> children);
}
