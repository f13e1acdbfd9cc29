package com.docfusion.core.pages;

import java.util.List;
import java.util.Objects;

/**
 * Page that only groups other pages and has no content of its own.
 *
 * @param name display name
 * @param children grouped pages
 */
public record GroupedPage(
    String name,
    List<PageNode> children
) implements PageNode {

    /**
     * Compact constructor with validation.
     */
    public GroupedPage {
        Objects.requireNonNull(name, "name must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public GroupedPage withChildren(List<PageNode> newChildren) {
        return new GroupedPage(name, newChildren);
    }
}
