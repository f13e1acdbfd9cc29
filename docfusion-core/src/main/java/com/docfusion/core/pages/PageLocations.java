package com.docfusion.core.pages;

import com.docfusion.core.model.DocumentableKind;

import java.util.function.BiConsumer;

/**
 * Assigns every page of a tree its output path relative to the output root.
 *
 * <p>Layout:
 * <ul>
 *   <li>root page: {@code index.md}</li>
 *   <li>package page: {@code <package dirs>/package-summary.md}; the unnamed package uses
 *       {@code root-package/package-summary.md}. Not a legal type name, so it never clashes
 *       with a type page</li>
 *   <li>type page: {@code <package dirs>/<Outer>.<Inner>.md}</li>
 *   <li>renderer-specific page: its own {@link RendererSpecificPage#path()}</li>
 *   <li>multi-module page: {@code <name>.md} in the current directory</li>
 *   <li>grouped page: no file; its children are laid out under {@code <name>/}</li>
 * </ul>
 */
public final class PageLocations {

    static final String ROOT_PACKAGE_DIR = "root-package";
    static final String PACKAGE_PAGE = "package-summary.md";

    private PageLocations() {
        // Utility class
    }

    /**
     * Visits every page depth-first, parents before children.
     *
     * @param root page tree
     * @param visitor receives each page and its relative path; grouped pages get their
     *                directory path ending in {@code /}
     */
    public static void walk(RootPageNode root, BiConsumer<PageNode, String> visitor) {
        visitor.accept(root, "index.md");
        for (PageNode child : root.children()) {
            walk(child, "", null, visitor);
        }
    }

    /**
     * Computes the path of a page link relative to another page.
     *
     * @param from path of the linking page
     * @param to path of the linked page
     * @return relative link
     */
    public static String relativeLink(String from, String to) {
        int depth = (int) from.chars().filter(c -> c == '/').count();
        return "../".repeat(depth) + to;
    }

    private static void walk(PageNode page, String directory, String typePrefix,
                             BiConsumer<PageNode, String> visitor) {
        if (page instanceof ContentPage content) {
            if (typePrefix == null && content.kind() == DocumentableKind.PACKAGE) {
                String packageDir = directory + packageDirectory(content.documentable().path());
                visitor.accept(page, packageDir + "/" + PACKAGE_PAGE);
                for (PageNode child : page.children()) {
                    walk(child, packageDir + "/", "", visitor);
                }
            } else {
                String base = typePrefix == null || typePrefix.isEmpty()
                    ? content.name() : typePrefix + "." + content.name();
                visitor.accept(page, directory + base + ".md");
                for (PageNode child : page.children()) {
                    walk(child, directory, base, visitor);
                }
            }
        } else if (page instanceof RendererSpecificPage specific) {
            visitor.accept(page, specific.path());
            for (PageNode child : page.children()) {
                walk(child, directory, typePrefix, visitor);
            }
        } else if (page instanceof GroupedPage) {
            String groupDir = directory + page.name() + "/";
            visitor.accept(page, groupDir);
            for (PageNode child : page.children()) {
                walk(child, groupDir, null, visitor);
            }
        } else {
            visitor.accept(page, directory + page.name() + ".md");
            for (PageNode child : page.children()) {
                walk(child, directory, typePrefix, visitor);
            }
        }
    }

    private static String packageDirectory(String packageName) {
        return packageName.isEmpty() ? ROOT_PACKAGE_DIR : packageName.replace('.', '/');
    }
}
