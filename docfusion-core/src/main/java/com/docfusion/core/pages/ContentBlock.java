package com.docfusion.core.pages;

import com.docfusion.core.model.PlatformData;

import java.util.List;
import java.util.Objects;

/**
 * Unit of page content, optionally restricted to a subset of platforms.
 *
 * <p>An empty {@code platforms} list means the block applies to every platform of the
 * enclosing page. Blocks tagged with specific platforms let a renderer show per-platform
 * tabs for one logical declaration.
 *
 * @param kind block kind
 * @param text block text (title, prose, signature or URL depending on kind)
 * @param platforms platforms this block applies to; empty for all
 * @param children nested blocks
 */
public record ContentBlock(
    ContentKind kind,
    String text,
    List<PlatformData> platforms,
    List<ContentBlock> children
) {
    /**
     * Compact constructor with validation.
     */
    public ContentBlock {
        Objects.requireNonNull(kind, "kind must not be null");
        if (text == null) {
            text = "";
        }
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a block that applies to every platform.
     *
     * @param kind block kind
     * @param text block text
     * @return content block
     */
    public static ContentBlock of(ContentKind kind, String text) {
        return new ContentBlock(kind, text, List.of(), List.of());
    }

    /**
     * Creates a block restricted to the given platforms.
     *
     * @param kind block kind
     * @param text block text
     * @param platforms platforms the block applies to
     * @return content block
     */
    public static ContentBlock forPlatforms(ContentKind kind, String text, List<PlatformData> platforms) {
        return new ContentBlock(kind, text, platforms, List.of());
    }

    /**
     * Creates a section grouping nested blocks.
     *
     * @param title section title
     * @param children nested blocks
     * @return section block
     */
    public static ContentBlock section(String title, List<ContentBlock> children) {
        return new ContentBlock(ContentKind.SECTION, title, List.of(), children);
    }

    /**
     * Returns true if this block is restricted to specific platforms.
     *
     * @return true if platform-tagged
     */
    public boolean isPlatformSpecific() {
        return !platforms.isEmpty();
    }
}
