package com.docfusion.core.pages;

import java.util.List;
import java.util.Objects;

/**
 * Page whose output is fully prepared by a transformer and written verbatim by the renderer
 * (navigation, search index, copied resources).
 *
 * @param name display name
 * @param path output path relative to the output root
 * @param content exact file content
 * @param children nested pages
 */
public record RendererSpecificPage(
    String name,
    String path,
    String content,
    List<PageNode> children
) implements PageNode {

    /**
     * Compact constructor with validation.
     */
    public RendererSpecificPage {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (content == null) {
            content = "";
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public RendererSpecificPage withChildren(List<PageNode> newChildren) {
        return new RendererSpecificPage(name, path, content, newChildren);
    }
}
