package com.docfusion.core;

import com.docfusion.core.analysis.AnalysisContext;
import com.docfusion.core.analysis.AnalysisEnvironmentFactory;
import com.docfusion.core.analysis.FrontEnd;
import com.docfusion.core.analysis.LoggingMessageCollector;
import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.analysis.impl.JavaParserAnalysisEnvironmentFactory;
import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.exception.ConfigurationException;
import com.docfusion.core.exception.StageFailureException;
import com.docfusion.core.logging.DocLogger;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.CoreExtensions;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.plugin.DocPlugin;
import com.docfusion.core.plugin.ExtensionRegistry;
import com.docfusion.core.plugin.PluginInitializer;
import com.docfusion.core.transformer.TransformChain;
import com.docfusion.core.translator.FileTranslator;
import com.docfusion.core.translator.SymbolTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the documentation pipeline.
 *
 * <p><b>Stages:</b> set up analysis, initialize plugins, translate every platform in parallel,
 * merge, transform the model, create pages, transform pages, render. Each stage is also
 * available as its own method so callers can drive a run step by step.
 *
 * <p><b>Failures:</b> a {@link ConfigurationException} propagates unchanged. Anything else
 * thrown inside a stage is logged and rethrown as a {@link StageFailureException} naming the
 * stage; no later stage runs. Analysis diagnostics never abort a run; they surface in the
 * {@link GenerationReport}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocFusionConfig config = ConfigLoader.load(Path.of("docfusion.yaml"));
 * GenerationReport report = new DocGenerator(config, new Slf4jDocLogger()).generate();
 * }</pre>
 */
public class DocGenerator {

    private static final Logger log = LoggerFactory.getLogger(DocGenerator.class);

    private final DocFusionConfig config;
    private final DocLogger logger;
    private final AnalysisEnvironmentFactory environmentFactory;
    private final List<DocPlugin> pluginOverrides;

    public DocGenerator(DocFusionConfig config, DocLogger logger) {
        this(config, logger, new JavaParserAnalysisEnvironmentFactory(Path.of("")));
    }

    public DocGenerator(DocFusionConfig config, DocLogger logger, AnalysisEnvironmentFactory environmentFactory) {
        this(config, logger, environmentFactory, List.of());
    }

    /**
     * Creates a generator.
     *
     * @param config run configuration
     * @param logger pipeline logger
     * @param environmentFactory builds the per-platform analysis contexts
     * @param pluginOverrides plugins installed in addition to the discovered ones; a plugin with
     *                        the id of a discovered plugin replaces it
     */
    public DocGenerator(DocFusionConfig config, DocLogger logger, AnalysisEnvironmentFactory environmentFactory,
                        List<DocPlugin> pluginOverrides) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        this.environmentFactory = Objects.requireNonNull(environmentFactory, "environmentFactory must not be null");
        this.pluginOverrides = List.copyOf(pluginOverrides);
    }

    /**
     * Runs every stage in order and reports the accumulated diagnostics.
     *
     * @return run outcome
     * @throws ConfigurationException if the configuration or the plugin setup is invalid
     * @throws StageFailureException if a stage fails
     */
    public GenerationReport generate() {
        Map<PlatformData, PlatformContext> platforms = setUpAnalysis();
        DocContext context = initializePlugins(platforms);
        List<Module> modules = createDocumentationModels(context);
        Module merged = mergeDocumentationModels(modules, context);
        Module transformed = transformDocumentationModel(merged, context);
        RootPageNode pages = createPages(transformed, context);
        RootPageNode transformedPages = transformPages(pages, context);
        render(transformedPages, context);

        logger.report();

        boolean analysisErrors = platforms.values().stream()
            .map(PlatformContext::analysis)
            .map(AnalysisContext::messageCollector)
            .anyMatch(collector -> collector.hasErrors());
        return new GenerationReport(analysisErrors, logger.warningsCount(), logger.errorsCount());
    }

    /**
     * Builds one analysis context per configured pass.
     *
     * @return platform contexts in pass order
     * @throws ConfigurationException if there are no passes or two passes describe the same platform
     */
    public Map<PlatformData, PlatformContext> setUpAnalysis() {
        return runStage(PipelineStage.SETUP_ANALYSIS, () -> {
            if (config.passes().isEmpty()) {
                throw new ConfigurationException("No passes configured: nothing to document");
            }
            Map<PlatformData, PlatformContext> platforms = new LinkedHashMap<>();
            for (PassConfig pass : config.passes()) {
                PlatformData platformData = pass.platformData();
                if (platforms.containsKey(platformData)) {
                    throw new ConfigurationException("Duplicate platform " + platformData
                        + ": every pass needs a distinct module name, platform or target list");
                }
                log.debug("Creating analysis environment for {}", platformData);
                AnalysisContext analysis = environmentFactory.create(pass, new LoggingMessageCollector(logger));
                platforms.put(platformData, new PlatformContext(platformData, pass, analysis));
            }
            return platforms;
        });
    }

    /**
     * Discovers, orders and installs plugins and freezes the registry.
     *
     * @param platforms platform contexts from {@link #setUpAnalysis()}
     * @return run context
     * @throws ConfigurationException on plugin cycles or unresolvable core extension points
     */
    public DocContext initializePlugins(Map<PlatformData, PlatformContext> platforms) {
        return runStage(PipelineStage.INITIALIZE_PLUGINS, () -> {
            PluginInitializer initializer = new PluginInitializer(logger);
            List<DocPlugin> discovered = initializer.discover(DocGenerator.class.getClassLoader());
            List<DocPlugin> ordered = initializer.order(initializer.combine(discovered, pluginOverrides));
            log.info("Installing {} plugin(s): {}", ordered.size(), ordered.stream().map(DocPlugin::id).toList());
            ExtensionRegistry registry = initializer.install(ordered, config);
            return new DocContext(config, logger, platforms, registry, ordered);
        });
    }

    /**
     * Translates every platform concurrently.
     *
     * <p>Every platform goes through the symbol translator. Only platforms analyzed by the
     * {@link FrontEnd#JAVA_SOURCE} front end also go through the file translator; the others
     * contribute an empty file module. When one platform fails, the remaining translations are
     * cancelled and the worker pool is shut down before the failure propagates.
     *
     * @param context run context
     * @return symbol-translated modules in pass order, followed by file-translated modules in
     *         pass order
     */
    public List<Module> createDocumentationModels(DocContext context) {
        return runStage(PipelineStage.CREATE_MODELS, () -> translateAll(context));
    }

    public Module mergeDocumentationModels(List<Module> modules, DocContext context) {
        return runStage(PipelineStage.MERGE_MODELS,
            () -> context.single(CoreExtensions.DOCUMENTABLE_MERGER).merge(modules, context));
    }

    public Module transformDocumentationModel(Module module, DocContext context) {
        return runStage(PipelineStage.TRANSFORM_MODEL,
            () -> TransformChain.fold(module, context.get(CoreExtensions.DOCUMENTABLE_TRANSFORMER),
                (transformer, current) -> transformer.transform(current, context)));
    }

    public RootPageNode createPages(Module module, DocContext context) {
        return runStage(PipelineStage.CREATE_PAGES,
            () -> context.single(CoreExtensions.PAGE_TRANSLATOR).translate(module, context));
    }

    public RootPageNode transformPages(RootPageNode root, DocContext context) {
        return runStage(PipelineStage.TRANSFORM_PAGES,
            () -> TransformChain.fold(root, context.get(CoreExtensions.PAGE_TRANSFORMER),
                (transformer, current) -> transformer.transform(current, context)));
    }

    public void render(RootPageNode root, DocContext context) {
        runStage(PipelineStage.RENDER, () -> {
            context.single(CoreExtensions.RENDERER).render(root);
            return null;
        });
    }

    private <T> T runStage(PipelineStage stage, Supplier<T> body) {
        logger.progress(stage.progressMessage());
        try {
            return body.get();
        } catch (ConfigurationException e) {
            throw e;
        } catch (StageFailureException e) {
            logger.error(e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            StageFailureException failure = new StageFailureException(stage, e);
            logger.error(failure.getMessage());
            log.debug("Stage {} failed", stage, e);
            throw failure;
        }
    }

    private List<Module> translateAll(DocContext context) {
        SymbolTranslator symbolTranslator = context.single(CoreExtensions.SYMBOL_TRANSLATOR);
        FileTranslator fileTranslator = context.single(CoreExtensions.FILE_TRANSLATOR);
        List<PlatformContext> platforms = List.copyOf(context.platforms().values());
        if (platforms.isEmpty()) {
            return List.of();
        }

        int threads = Math.max(1, Math.min(platforms.size(), config.parallelism()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, translatorThreads());
        CompletionService<Translated> completion = new ExecutorCompletionService<>(executor);
        List<Future<Translated>> futures = new ArrayList<>(platforms.size());
        try {
            for (int i = 0; i < platforms.size(); i++) {
                int index = i;
                PlatformContext platform = platforms.get(i);
                futures.add(completion.submit(() ->
                    translate(index, platform, context, symbolTranslator, fileTranslator)));
            }

            Translated[] results = new Translated[platforms.size()];
            for (int i = 0; i < platforms.size(); i++) {
                Translated translated = awaitNext(completion, futures, platforms);
                results[translated.index()] = translated;
                log.debug("Translated {}", platforms.get(translated.index()).platformData());
            }

            List<Module> modules = new ArrayList<>(platforms.size() * 2);
            for (Translated translated : results) {
                modules.add(translated.symbolModule());
            }
            for (Translated translated : results) {
                modules.add(translated.fileModule());
            }
            return modules;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Translated translate(int index, PlatformContext platform, DocContext context,
                                        SymbolTranslator symbolTranslator, FileTranslator fileTranslator) {
        Module symbolModule = symbolTranslator.translate(platform, context);
        Module fileModule = platform.analysis().frontEnd() == FrontEnd.JAVA_SOURCE
            ? fileTranslator.translate(platform, context)
            : Module.empty(platform.platformData().name(), platform.platformData());
        return new Translated(index, symbolModule, fileModule);
    }

    private Translated awaitNext(CompletionService<Translated> completion, List<Future<Translated>> futures,
                                 List<PlatformContext> platforms) {
        Future<Translated> done;
        try {
            done = completion.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new StageFailureException(PipelineStage.CREATE_MODELS,
                "Interrupted while translating documentation models", e);
        }
        try {
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new StageFailureException(PipelineStage.CREATE_MODELS,
                "Interrupted while translating documentation models", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            int failed = futures.indexOf(done);
            String platform = failed >= 0 ? platforms.get(failed).platformData().toString() : "unknown platform";
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StageFailureException(PipelineStage.CREATE_MODELS,
                "Translation of " + platform + " failed: " + cause.getMessage(), cause);
        }
    }

    private static void cancelAll(List<Future<Translated>> futures) {
        futures.forEach(future -> future.cancel(true));
    }

    private static ThreadFactory translatorThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "docfusion-translate-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Translated(int index, Module symbolModule, Module fileModule) {}
}
