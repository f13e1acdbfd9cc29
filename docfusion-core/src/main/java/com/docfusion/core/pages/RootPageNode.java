package com.docfusion.core.pages;

import com.docfusion.core.model.PlatformData;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the page tree; exactly one per run.
 *
 * @param name module name shown on the root page
 * @param platforms every platform the documented module covers
 * @param content module-level content
 * @param children top-level pages
 */
public record RootPageNode(
    String name,
    List<PlatformData> platforms,
    List<ContentBlock> content,
    List<PageNode> children
) implements PageNode {

    /**
     * Compact constructor with validation.
     */
    public RootPageNode {
        Objects.requireNonNull(name, "name must not be null");
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        content = content == null ? List.of() : List.copyOf(content);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public RootPageNode withChildren(List<PageNode> newChildren) {
        return new RootPageNode(name, platforms, content, newChildren);
    }

    /**
     * Returns a copy with one more top-level page appended.
     *
     * @param page page to append
     * @return new root
     */
    public RootPageNode withChild(PageNode page) {
        List<PageNode> appended = new ArrayList<>(children);
        appended.add(page);
        return withChildren(appended);
    }
}
