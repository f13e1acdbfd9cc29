package com.docfusion.core.base;

import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.merger.DefaultDocumentableMerger;
import com.docfusion.core.plugin.CoreExtensions;
import com.docfusion.core.plugin.DocPlugin;
import com.docfusion.core.plugin.ExtensionRegistry;
import com.docfusion.core.renderer.impl.MarkdownRenderer;
import com.docfusion.core.transformer.impl.DeprecatedDocumentableFilter;
import com.docfusion.core.transformer.impl.EmptyPackagesFilter;
import com.docfusion.core.transformer.impl.ExternalDocumentationLinksTransformer;
import com.docfusion.core.transformer.impl.IndexPageInstaller;
import com.docfusion.core.transformer.impl.NavigationPageInstaller;
import com.docfusion.core.transformer.impl.SearchIndexInstaller;
import com.docfusion.core.transformer.impl.SourceLinksTransformer;
import com.docfusion.core.transformer.impl.SuppressedDocumentableFilter;
import com.docfusion.core.transformer.impl.UndocumentedReporter;
import com.docfusion.core.transformer.impl.VisibilityFilter;
import com.docfusion.core.translator.impl.DefaultPageTranslator;
import com.docfusion.core.translator.impl.DefaultSymbolTranslator;
import com.docfusion.core.translator.impl.JavaSourceTranslator;

import java.nio.file.Path;

/**
 * Installs the default implementation of every core extension point.
 *
 * <p>The Markdown renderer is only installed for the {@code markdown} format; any other format
 * needs a plugin that registers a renderer.
 */
public class BasePlugin implements DocPlugin {

    public static final String ID = "base";
    public static final String MARKDOWN_FORMAT = "markdown";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void install(ExtensionRegistry.Builder registry, DocFusionConfig config) {
        registry.register(CoreExtensions.SYMBOL_TRANSLATOR, new DefaultSymbolTranslator());
        registry.register(CoreExtensions.FILE_TRANSLATOR, new JavaSourceTranslator());
        registry.register(CoreExtensions.DOCUMENTABLE_MERGER, new DefaultDocumentableMerger());

        registry.register(CoreExtensions.DOCUMENTABLE_TRANSFORMER, new SuppressedDocumentableFilter());
        registry.register(CoreExtensions.DOCUMENTABLE_TRANSFORMER, new VisibilityFilter());
        registry.register(CoreExtensions.DOCUMENTABLE_TRANSFORMER, new DeprecatedDocumentableFilter());
        registry.register(CoreExtensions.DOCUMENTABLE_TRANSFORMER, new EmptyPackagesFilter());
        registry.register(CoreExtensions.DOCUMENTABLE_TRANSFORMER, new UndocumentedReporter());

        registry.register(CoreExtensions.PAGE_TRANSLATOR, new DefaultPageTranslator());

        registry.register(CoreExtensions.PAGE_TRANSFORMER, new SourceLinksTransformer());
        registry.register(CoreExtensions.PAGE_TRANSFORMER, new ExternalDocumentationLinksTransformer());
        registry.register(CoreExtensions.PAGE_TRANSFORMER, new NavigationPageInstaller());
        registry.register(CoreExtensions.PAGE_TRANSFORMER, new SearchIndexInstaller());
        registry.register(CoreExtensions.PAGE_TRANSFORMER, new IndexPageInstaller());

        if (MARKDOWN_FORMAT.equalsIgnoreCase(config.format())) {
            registry.register(CoreExtensions.RENDERER, new MarkdownRenderer(Path.of(config.outputDir())));
        }
    }
}
