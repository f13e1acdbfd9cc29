package com.docfusion.core.pages;

import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Page documenting one package or type.
 *
 * @param name display name
 * @param documentable id of the documented declaration
 * @param kind kind of the documented declaration
 * @param platforms platforms the declaration is available on
 * @param sources source location of the declaration per platform, where known
 * @param content page content
 * @param children nested pages (types of a package, nested types of a type)
 */
public record ContentPage(
    String name,
    DocumentableId documentable,
    DocumentableKind kind,
    List<PlatformData> platforms,
    Map<PlatformData, SourceLocation> sources,
    List<ContentBlock> content,
    List<PageNode> children
) implements PageNode {

    /**
     * Compact constructor with validation.
     */
    public ContentPage {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(documentable, "documentable must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        sources = sources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        content = content == null ? List.of() : List.copyOf(content);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ContentPage withChildren(List<PageNode> newChildren) {
        return new ContentPage(name, documentable, kind, platforms, sources, content, newChildren);
    }

    /**
     * Returns a copy with different content.
     *
     * @param newContent replacement content
     * @return new page
     */
    public ContentPage withContent(List<ContentBlock> newContent) {
        return new ContentPage(name, documentable, kind, platforms, sources, newContent, children);
    }

    /**
     * Returns a copy with one more content block appended.
     *
     * @param block block to append
     * @return new page
     */
    public ContentPage withBlock(ContentBlock block) {
        List<ContentBlock> appended = new ArrayList<>(content);
        appended.add(block);
        return withContent(appended);
    }
}
