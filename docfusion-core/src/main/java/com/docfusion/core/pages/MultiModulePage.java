package com.docfusion.core.pages;

import java.util.List;
import java.util.Objects;

/**
 * Page listing several documented modules.
 *
 * @param name display name
 * @param modules module names, in display order
 * @param content page content
 * @param children nested pages
 */
public record MultiModulePage(
    String name,
    List<String> modules,
    List<ContentBlock> content,
    List<PageNode> children
) implements PageNode {

    /**
     * Compact constructor with validation.
     */
    public MultiModulePage {
        Objects.requireNonNull(name, "name must not be null");
        modules = modules == null ? List.of() : List.copyOf(modules);
        content = content == null ? List.of() : List.copyOf(content);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public MultiModulePage withChildren(List<PageNode> newChildren) {
        return new MultiModulePage(name, modules, content, newChildren);
    }
}
