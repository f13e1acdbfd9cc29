package com.docfusion.core.transformer.impl;

import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.pages.ContentPage;
import com.docfusion.core.pages.GroupedPage;
import com.docfusion.core.pages.PageLocations;
import com.docfusion.core.pages.PageNode;
import com.docfusion.core.pages.RendererSpecificPage;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.PageTransformer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Appends an alphabetical index of types when {@code generateIndexPages} is set: a grouped page
 * {@code index} with one page per initial letter.
 */
public class IndexPageInstaller implements PageTransformer {

    static final String GROUP_NAME = "index";
    static final String OTHER = "other";

    @Override
    public RootPageNode transform(RootPageNode root, DocContext context) {
        if (!context.config().generateIndexPages()) {
            return root;
        }

        Map<String, List<Entry>> byLetter = new TreeMap<>();
        PageLocations.walk(root, (page, path) -> {
            if (page instanceof ContentPage content && content.kind() != DocumentableKind.PACKAGE) {
                byLetter.computeIfAbsent(letter(content.name()), key -> new ArrayList<>())
                    .add(new Entry(content.name(), content.documentable().path(), path));
            }
        });

        List<PageNode> letterPages = new ArrayList<>();
        byLetter.forEach((letter, entries) -> {
            String pagePath = GROUP_NAME + "/" + letter + ".md";
            StringBuilder markdown = new StringBuilder("# ").append(letter).append("\n\n");
            entries.stream()
                .sorted(Comparator.comparing(Entry::name).thenComparing(Entry::qualifiedName))
                .forEach(entry -> markdown.append("- [").append(entry.name()).append("](")
                    .append(PageLocations.relativeLink(pagePath, entry.path())).append(") ")
                    .append('`').append(entry.qualifiedName()).append("`\n"));
            letterPages.add(new RendererSpecificPage(letter, pagePath, markdown.toString(), List.of()));
        });

        return root.withChild(new GroupedPage(GROUP_NAME, letterPages));
    }

    private static String letter(String name) {
        char first = name.isEmpty() ? '_' : name.charAt(0);
        return Character.isLetter(first) ? String.valueOf(Character.toUpperCase(first)) : OTHER;
    }

    private record Entry(String name, String qualifiedName, String path) {}
}
