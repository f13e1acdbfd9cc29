package com.docfusion.core.transformer.impl;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.pages.ContentBlock;
import com.docfusion.core.pages.ContentKind;
import com.docfusion.core.pages.ContentPage;
import com.docfusion.core.pages.PageNode;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.PageTransformer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Links type references to the documentation of external libraries.
 *
 * <p>Each {@code externalDocumentationLinks} entry of a pass names a documentation URL and its
 * package list. A {@code TYPE_REFERENCE} block whose qualified name lies in a listed package
 * gets a nested {@code LINK} block pointing to {@code <url>/<package dirs>/<Type>.html}; the
 * longest listed package prefix wins. Only links of the passes the block applies to are
 * consulted, in pass order. Package lists are cached under {@code cacheRoot} when it is set.
 *
 * <p>A package list that cannot be loaded is reported as a warning and its link is skipped.
 */
public class ExternalDocumentationLinksTransformer implements PageTransformer {

    @Override
    public RootPageNode transform(RootPageNode root, DocContext context) {
        Map<PlatformData, List<ExternalPackages>> byPlatform = loadLinks(context);
        if (byPlatform.values().stream().allMatch(List::isEmpty)) {
            return root;
        }
        Resolver resolver = new Resolver(byPlatform);
        return new RootPageNode(root.name(), root.platforms(), resolver.rewrite(root.content()),
            rewrite(root.children(), resolver));
    }

    private List<PageNode> rewrite(List<PageNode> pages, Resolver resolver) {
        List<PageNode> rewritten = new ArrayList<>(pages.size());
        for (PageNode page : pages) {
            PageNode withChildren = page.children().isEmpty() ? page : page.withChildren(rewrite(page.children(), resolver));
            rewritten.add(withChildren instanceof ContentPage content
                ? content.withContent(resolver.rewrite(content.content()))
                : withChildren);
        }
        return rewritten;
    }

    private Map<PlatformData, List<ExternalPackages>> loadLinks(DocContext context) {
        String cacheRoot = context.config().cacheRoot();
        PackageListCache cache = new PackageListCache(cacheRoot == null || cacheRoot.isBlank()
            ? null : Path.of(cacheRoot));
        Map<String, Optional<Set<String>>> loaded = new HashMap<>();

        Map<PlatformData, List<ExternalPackages>> byPlatform = new LinkedHashMap<>();
        for (PassConfig pass : context.config().passes()) {
            List<ExternalPackages> links = new ArrayList<>();
            for (PassConfig.ExternalDocumentationLink link : pass.externalDocumentationLinks()) {
                if (link.url() == null) {
                    continue;
                }
                loaded.computeIfAbsent(link.packageListUrl(), url -> load(cache, url, context))
                    .ifPresent(packages -> links.add(new ExternalPackages(stripSlash(link.url()), packages)));
            }
            byPlatform.put(pass.platformData(), links);
        }
        return byPlatform;
    }

    private static Optional<Set<String>> load(PackageListCache cache, String url, DocContext context) {
        try {
            return Optional.of(cache.packages(url));
        } catch (IOException e) {
            context.logger().warn("Cannot load package list " + url + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record ExternalPackages(String url, Set<String> packages) {

        Optional<String> resolve(String qualifiedName) {
            int dot = qualifiedName.lastIndexOf('.');
            while (dot > 0) {
                String packageName = qualifiedName.substring(0, dot);
                if (packages.contains(packageName)) {
                    return Optional.of(url + "/" + packageName.replace('.', '/') + "/"
                        + qualifiedName.substring(dot + 1) + ".html");
                }
                dot = packageName.lastIndexOf('.');
            }
            return Optional.empty();
        }
    }

    private static final class Resolver {

        private final Map<PlatformData, List<ExternalPackages>> byPlatform;

        private Resolver(Map<PlatformData, List<ExternalPackages>> byPlatform) {
            this.byPlatform = byPlatform;
        }

        List<ContentBlock> rewrite(List<ContentBlock> blocks) {
            List<ContentBlock> rewritten = new ArrayList<>(blocks.size());
            for (ContentBlock block : blocks) {
                if (block.kind() == ContentKind.TYPE_REFERENCE) {
                    rewritten.add(link(block));
                } else if (block.children().isEmpty()) {
                    rewritten.add(block);
                } else {
                    rewritten.add(new ContentBlock(block.kind(), block.text(), block.platforms(),
                        rewrite(block.children())));
                }
            }
            return rewritten;
        }

        private ContentBlock link(ContentBlock reference) {
            boolean linked = reference.children().stream().anyMatch(child -> child.kind() == ContentKind.LINK);
            if (linked) {
                return reference;
            }
            Optional<String> url = candidates(reference).stream()
                .map(external -> external.resolve(reference.text()))
                .flatMap(Optional::stream)
                .findFirst();
            return url
                .map(target -> new ContentBlock(ContentKind.TYPE_REFERENCE, reference.text(), reference.platforms(),
                    List.of(ContentBlock.of(ContentKind.LINK, target))))
                .orElse(reference);
        }

        private List<ExternalPackages> candidates(ContentBlock reference) {
            List<ExternalPackages> candidates = new ArrayList<>();
            byPlatform.forEach((platform, links) -> {
                if (!reference.isPlatformSpecific() || reference.platforms().contains(platform)) {
                    candidates.addAll(links);
                }
            });
            return candidates;
        }
    }
}
