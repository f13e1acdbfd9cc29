package com.docfusion.core.plugin;

import com.docfusion.core.merger.DocumentableMerger;
import com.docfusion.core.renderer.Renderer;
import com.docfusion.core.transformer.DocumentableTransformer;
import com.docfusion.core.transformer.PageTransformer;
import com.docfusion.core.translator.FileTranslator;
import com.docfusion.core.translator.PageTranslator;
import com.docfusion.core.translator.SymbolTranslator;

import java.util.List;

/**
 * Extension points the pipeline resolves.
 */
public final class CoreExtensions {

    public static final ExtensionPoint<SymbolTranslator> SYMBOL_TRANSLATOR =
        ExtensionPoint.single("symbolTranslator", SymbolTranslator.class);

    public static final ExtensionPoint<FileTranslator> FILE_TRANSLATOR =
        ExtensionPoint.single("fileTranslator", FileTranslator.class);

    public static final ExtensionPoint<DocumentableMerger> DOCUMENTABLE_MERGER =
        ExtensionPoint.single("documentableMerger", DocumentableMerger.class);

    public static final ExtensionPoint<DocumentableTransformer> DOCUMENTABLE_TRANSFORMER =
        ExtensionPoint.multi("documentableTransformer", DocumentableTransformer.class);

    public static final ExtensionPoint<PageTranslator> PAGE_TRANSLATOR =
        ExtensionPoint.single("pageTranslator", PageTranslator.class);

    public static final ExtensionPoint<PageTransformer> PAGE_TRANSFORMER =
        ExtensionPoint.multi("pageTransformer", PageTransformer.class);

    public static final ExtensionPoint<Renderer> RENDERER =
        ExtensionPoint.single("renderer", Renderer.class);

    private CoreExtensions() {
        // Utility class
    }

    /**
     * Returns the single-cardinality points that must resolve to exactly one implementation
     * before translation starts.
     *
     * @return required points in stage order
     */
    public static List<ExtensionPoint<?>> requiredSinglePoints() {
        return List.of(SYMBOL_TRANSLATOR, FILE_TRANSLATOR, DOCUMENTABLE_MERGER, PAGE_TRANSLATOR, RENDERER);
    }

    /**
     * Returns every core point.
     *
     * @return points in stage order
     */
    public static List<ExtensionPoint<?>> all() {
        return List.of(SYMBOL_TRANSLATOR, FILE_TRANSLATOR, DOCUMENTABLE_MERGER, DOCUMENTABLE_TRANSFORMER,
            PAGE_TRANSLATOR, PAGE_TRANSFORMER, RENDERER);
    }
}
