package com.docfusion.core.renderer.impl;

import com.docfusion.core.model.PlatformData;
import com.docfusion.core.pages.ContentBlock;
import com.docfusion.core.pages.ContentKind;
import com.docfusion.core.pages.ContentPage;
import com.docfusion.core.pages.GroupedPage;
import com.docfusion.core.pages.MultiModulePage;
import com.docfusion.core.pages.PageLocations;
import com.docfusion.core.pages.PageNode;
import com.docfusion.core.pages.RendererSpecificPage;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.renderer.FileSystemWriter;
import com.docfusion.core.renderer.GeneratedFile;
import com.docfusion.core.renderer.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a page tree as Markdown files.
 *
 * <h2>Output Layout</h2>
 * <pre>
 * outputDir/
 * ├── index.md                        # module page
 * ├── com/example/package-summary.md  # package page
 * ├── com/example/Cache.md            # type page
 * ├── com/example/Cache.Entry.md
 * ├── navigation.md                   # renderer-specific pages, verbatim
 * └── search-index.json
 * </pre>
 *
 * <p>When a page covers more than one platform, platform-specific blocks are prefixed with the
 * platforms they apply to.
 */
public class MarkdownRenderer implements Renderer {

    private static final Logger log = LoggerFactory.getLogger(MarkdownRenderer.class);

    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String CODE = "`";
    private static final String SOURCE_LABEL = "source";
    private static final int MAX_HEADER_LEVEL = 6;

    private final FileSystemWriter writer;

    public MarkdownRenderer(Path outputDir) {
        this.writer = new FileSystemWriter(outputDir);
    }

    @Override
    public void render(RootPageNode root) {
        List<GeneratedFile> files = renderFiles(root);
        writer.write(files);
        log.info("Rendered {} files to {}", files.size(), writer.outputDir());
    }

    /**
     * Renders a page tree to files without writing them.
     *
     * @param root page tree
     * @return files in page order
     */
    public List<GeneratedFile> renderFiles(RootPageNode root) {
        Map<PageNode, String> paths = new IdentityHashMap<>();
        List<PageNode> order = new ArrayList<>();
        PageLocations.walk(root, (page, path) -> {
            paths.put(page, path);
            order.add(page);
        });

        List<GeneratedFile> files = new ArrayList<>();
        for (PageNode page : order) {
            String path = paths.get(page);
            if (page instanceof RootPageNode rootPage) {
                files.add(new GeneratedFile(path,
                    renderBlocks(rootPage.content(), rootPage.platforms(), links(page, path, paths))));
            } else if (page instanceof ContentPage content) {
                files.add(new GeneratedFile(path,
                    renderBlocks(content.content(), content.platforms(), links(page, path, paths))));
            } else if (page instanceof RendererSpecificPage specific) {
                files.add(new GeneratedFile(path, specific.content()));
            } else if (page instanceof MultiModulePage multiModule) {
                files.add(new GeneratedFile(path, renderMultiModule(multiModule)));
            } else if (!(page instanceof GroupedPage)) {
                log.debug("No Markdown representation for page type {}", page.getClass().getSimpleName());
            }
        }
        return files;
    }

    private Map<String, String> links(PageNode page, String path, Map<PageNode, String> paths) {
        Map<String, String> links = new HashMap<>();
        for (PageNode child : page.children()) {
            if (child instanceof ContentPage) {
                links.putIfAbsent(child.name(), PageLocations.relativeLink(path, paths.get(child)));
            }
        }
        return links;
    }

    private String renderBlocks(List<ContentBlock> blocks, List<PlatformData> pagePlatforms, Map<String, String> links) {
        StringBuilder sb = new StringBuilder();
        boolean tagPlatforms = pagePlatforms.size() > 1;
        for (ContentBlock block : blocks) {
            appendBlock(sb, block, 1, tagPlatforms, links);
        }
        return sb.toString();
    }

    private void appendBlock(StringBuilder sb, ContentBlock block, int level, boolean tagPlatforms,
                             Map<String, String> links) {
        String tag = tagPlatforms && block.isPlatformSpecific() ? platformTag(block.platforms()) : "";
        switch (block.kind()) {
            case HEADER -> sb.append(header(level)).append(block.text()).append(DOUBLE_NEWLINE);
            case TEXT -> sb.append(tag).append(block.text()).append(DOUBLE_NEWLINE);
            case PLATFORMS -> sb.append("**Platforms:** ").append(block.text()).append(DOUBLE_NEWLINE);
            case DEPRECATION -> sb.append("> **").append(block.text()).append("**")
                .append(tag.isEmpty() ? "" : " " + tag.strip())
                .append(DOUBLE_NEWLINE);
            case LINK -> appendLink(sb, block, tag, links);
            case TYPE_REFERENCE -> appendTypeReference(sb, block, tag);
            case SIGNATURE -> {
                sb.append(header(level + 2)).append(CODE).append(block.text()).append(CODE).append(NEWLINE);
                if (!tag.isEmpty()) {
                    sb.append(NEWLINE).append(tag.strip()).append(NEWLINE);
                }
                sb.append(NEWLINE);
                for (ContentBlock child : block.children()) {
                    appendBlock(sb, child, level + 2, tagPlatforms, links);
                }
            }
            case SECTION -> {
                sb.append(header(level + 1)).append(block.text()).append(DOUBLE_NEWLINE);
                for (ContentBlock child : block.children()) {
                    appendBlock(sb, child, level + 1, tagPlatforms, links);
                }
                if (!block.children().isEmpty()
                        && isListItem(block.children().get(block.children().size() - 1).kind())) {
                    sb.append(NEWLINE);
                }
            }
        }
    }

    private void appendLink(StringBuilder sb, ContentBlock block, String tag, Map<String, String> links) {
        String target = links.get(block.text());
        if (target != null) {
            sb.append("- ").append(tag).append("[").append(block.text()).append("](").append(target).append(")")
                .append(NEWLINE);
        } else if (block.text().startsWith("http://") || block.text().startsWith("https://")) {
            sb.append(tag).append("[").append(SOURCE_LABEL).append("](").append(block.text()).append(")")
                .append(DOUBLE_NEWLINE);
        } else {
            sb.append("- ").append(tag).append(block.text()).append(NEWLINE);
        }
    }

    private void appendTypeReference(StringBuilder sb, ContentBlock block, String tag) {
        String name = CODE + block.text() + CODE;
        String rendered = block.children().stream()
            .filter(child -> child.kind() == ContentKind.LINK)
            .findFirst()
            .map(link -> "[" + name + "](" + link.text() + ")")
            .orElse(name);
        sb.append("- ").append(tag).append(rendered).append(NEWLINE);
    }

    private static boolean isListItem(ContentKind kind) {
        return kind == ContentKind.LINK || kind == ContentKind.TYPE_REFERENCE;
    }

    private String renderMultiModule(MultiModulePage page) {
        StringBuilder sb = new StringBuilder();
        sb.append(header(1)).append(page.name()).append(DOUBLE_NEWLINE);
        for (String module : page.modules()) {
            sb.append("- ").append(module).append(NEWLINE);
        }
        return sb.toString();
    }

    private static String header(int level) {
        return "#".repeat(Math.min(level, MAX_HEADER_LEVEL)) + " ";
    }

    private static String platformTag(List<PlatformData> platforms) {
        return platforms.stream()
            .map(PlatformData::toString)
            .collect(Collectors.joining(", ", "_[", "]_ "));
    }
}
