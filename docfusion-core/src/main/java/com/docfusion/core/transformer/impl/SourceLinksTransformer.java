package com.docfusion.core.transformer.impl;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.SourceLocation;
import com.docfusion.core.pages.ContentBlock;
import com.docfusion.core.pages.ContentKind;
import com.docfusion.core.pages.ContentPage;
import com.docfusion.core.pages.PageNode;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.PageTransformer;
import com.docfusion.core.util.FileUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adds a link to the remote source of each declaration page, per platform.
 *
 * <p>A {@code sourceLinks} entry maps a local directory to a remote URL. The first entry whose
 * directory contains the declaration's file produces a {@code LINK} block tagged with the
 * platform; with a {@code lineSuffix} (e.g. {@code "#L"}) the line number is appended. Relative
 * directories resolve against the analysis base directory of the pass.
 */
public class SourceLinksTransformer implements PageTransformer {

    @Override
    public RootPageNode transform(RootPageNode root, DocContext context) {
        return root.withChildren(rewrite(root.children(), context));
    }

    private List<PageNode> rewrite(List<PageNode> pages, DocContext context) {
        List<PageNode> rewritten = new ArrayList<>(pages.size());
        for (PageNode page : pages) {
            PageNode withChildren = page.children().isEmpty() ? page : page.withChildren(rewrite(page.children(), context));
            rewritten.add(withChildren instanceof ContentPage content ? addLinks(content, context) : withChildren);
        }
        return rewritten;
    }

    private ContentPage addLinks(ContentPage page, DocContext context) {
        ContentPage linked = page;
        for (Map.Entry<PlatformData, SourceLocation> source : page.sources().entrySet()) {
            Path baseDirectory = context.baseDirectoryFor(source.getKey());
            Optional<String> url = context.passFor(source.getKey())
                .flatMap(pass -> remoteUrl(pass, baseDirectory, source.getValue()));
            if (url.isPresent()) {
                linked = linked.withBlock(ContentBlock.forPlatforms(ContentKind.LINK, url.get(), List.of(source.getKey())));
            }
        }
        return linked;
    }

    static Optional<String> remoteUrl(PassConfig pass, Path baseDirectory, SourceLocation location) {
        for (PassConfig.SourceLink link : pass.sourceLinks()) {
            if (link.path() == null || link.url() == null) {
                continue;
            }
            String localRoot = FileUtils.toAbsoluteUnixPath(baseDirectory, link.path());
            if (!location.path().startsWith(localRoot + "/")) {
                continue;
            }
            String relative = location.path().substring(localRoot.length() + 1);
            String base = link.url().endsWith("/") ? link.url().substring(0, link.url().length() - 1) : link.url();
            String suffix = link.lineSuffix() != null && location.line() > 0 ? link.lineSuffix() + location.line() : "";
            return Optional.of(base + "/" + relative + suffix);
        }
        return Optional.empty();
    }
}
