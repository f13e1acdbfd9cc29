package com.docfusion.core.renderer;

import com.docfusion.core.pages.RootPageNode;

/**
 * Produces the externally visible output of a run from the final page tree.
 *
 * <p>Registered on {@link com.docfusion.core.plugin.CoreExtensions#RENDERER}. The pipeline
 * does not inspect what a renderer produced; a failure must be signalled by throwing.
 */
@FunctionalInterface
public interface Renderer {

    /**
     * Renders a page tree.
     *
     * @param root final page tree
     */
    void render(RootPageNode root);
}
