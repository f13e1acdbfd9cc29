package com.docfusion.core.transformer.impl;

import com.docfusion.core.pages.ContentPage;
import com.docfusion.core.pages.PageLocations;
import com.docfusion.core.pages.PageNode;
import com.docfusion.core.pages.RendererSpecificPage;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.PageTransformer;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends a navigation page listing the content page hierarchy as a nested Markdown list.
 */
public class NavigationPageInstaller implements PageTransformer {

    static final String NAME = "navigation";
    static final String PATH = "navigation.md";

    @Override
    public RootPageNode transform(RootPageNode root, DocContext context) {
        Map<PageNode, String> paths = new IdentityHashMap<>();
        PageLocations.walk(root, paths::put);

        StringBuilder markdown = new StringBuilder();
        markdown.append("- [").append(root.name()).append("](index.md)\n");
        append(markdown, root.children(), paths, 1);

        return root.withChild(new RendererSpecificPage(NAME, PATH, markdown.toString(), List.of()));
    }

    private void append(StringBuilder markdown, List<PageNode> pages, Map<PageNode, String> paths, int depth) {
        for (PageNode page : pages) {
            if (page instanceof ContentPage) {
                markdown.append("  ".repeat(depth))
                    .append("- [").append(page.name()).append("](").append(paths.get(page)).append(")\n");
                append(markdown, page.children(), paths, depth + 1);
            }
        }
    }
}
