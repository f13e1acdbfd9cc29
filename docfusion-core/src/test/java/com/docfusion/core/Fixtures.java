package com.docfusion.core;

import com.docfusion.core.analysis.LoggingMessageCollector;
import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.base.BasePlugin;
import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.AnalysisPlatform;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.model.SourceLocation;
import com.docfusion.core.model.Visibility;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.plugin.ExtensionRegistry;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for documentation trees and run contexts used across tests.
 */
public final class Fixtures {

    public static final PlatformData JVM = PlatformData.of("lib", AnalysisPlatform.JVM);
    public static final PlatformData JS = PlatformData.of("lib", AnalysisPlatform.JS);

    private Fixtures() {
    }

    public static PassConfig pass(PlatformData platform) {
        return new PassConfig(platform.name(), platform.platform().key(), platform.targets(),
            List.of("src"), null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static PassConfig pass(PlatformData platform, Boolean includeNonPublic, Boolean reportUndocumented,
                                  Boolean skipDeprecated, Boolean skipEmptyPackages, List<String> suppressedFiles,
                                  List<PassConfig.PackageOptions> perPackageOptions) {
        return new PassConfig(platform.name(), platform.platform().key(), platform.targets(),
            List.of("src"), null, null, null, null, null, includeNonPublic, reportUndocumented, skipDeprecated,
            skipEmptyPackages, suppressedFiles, perPackageOptions, null, null);
    }

    public static DocFusionConfig config(PassConfig... passes) {
        return new DocFusionConfig(null, null, null, null, 2, null, List.of(passes));
    }

    /**
     * Context with every default extension installed and one pass per given platform.
     */
    public static DocContext context(DocFusionConfig config, RecordingDocLogger logger) {
        ExtensionRegistry.Builder builder = ExtensionRegistry.builder();
        new BasePlugin().install(builder, config);
        return new DocContext(config, logger, Map.of(), builder.build(), List.of());
    }

    /**
     * Context whose passes were analyzed with the given base directory.
     */
    public static DocContext context(DocFusionConfig config, RecordingDocLogger logger, Path baseDirectory) {
        FakeAnalysisEnvironmentFactory analysis = new FakeAnalysisEnvironmentFactory(baseDirectory);
        Map<PlatformData, PlatformContext> platforms = new LinkedHashMap<>();
        for (PassConfig pass : config.passes()) {
            platforms.put(pass.platformData(), new PlatformContext(pass.platformData(), pass,
                analysis.create(pass, new LoggingMessageCollector(logger))));
        }
        ExtensionRegistry.Builder builder = ExtensionRegistry.builder();
        new BasePlugin().install(builder, config);
        return new DocContext(config, logger, platforms, builder.build(), List.of());
    }

    public static DocContext context(PlatformData... platforms) {
        PassConfig[] passes = new PassConfig[platforms.length];
        for (int i = 0; i < platforms.length; i++) {
            passes[i] = pass(platforms[i]);
        }
        return context(config(passes), new RecordingDocLogger());
    }

    public static PlatformFacts facts(String documentation) {
        return PlatformFacts.documented(documentation);
    }

    public static PlatformFacts facts(String documentation, Visibility visibility, boolean deprecated) {
        return new PlatformFacts(documentation, visibility, null, List.of(), deprecated, List.of(), List.of());
    }

    public static PlatformFacts factsAt(String documentation, String path, int line) {
        return new PlatformFacts(documentation, Visibility.PUBLIC, new SourceLocation(path, line), List.of(),
            false, List.of(), List.of());
    }

    public static Documentable pkg(String name, PlatformData platform, Documentable... members) {
        return new Documentable(DocumentableId.of(name), name, DocumentableKind.PACKAGE,
            Map.of(platform, PlatformFacts.empty()), List.of(members), null);
    }

    public static Documentable type(String qualifiedName, DocumentableKind kind, PlatformData platform,
                                    PlatformFacts facts, Documentable... members) {
        int dot = qualifiedName.lastIndexOf('.');
        DocumentableId parent = DocumentableId.of(dot < 0 ? "" : qualifiedName.substring(0, dot));
        String name = qualifiedName.substring(dot + 1);
        return new Documentable(DocumentableId.of(qualifiedName), name, kind, Map.of(platform, facts),
            List.of(members), parent);
    }

    public static Documentable cls(String qualifiedName, PlatformData platform, String documentation,
                                   Documentable... members) {
        return type(qualifiedName, DocumentableKind.CLASS, platform, facts(documentation), members);
    }

    public static Documentable function(String ownerName, String name, String signature, PlatformData platform,
                                        PlatformFacts facts) {
        DocumentableId owner = DocumentableId.of(ownerName);
        return new Documentable(owner.child(name, signature), name, DocumentableKind.FUNCTION,
            Map.of(platform, facts), List.of(), owner);
    }

    public static Module module(String name, PlatformData platform, Documentable... packages) {
        return new Module(name, Map.of(platform, PlatformFacts.empty()), List.of(packages));
    }
}
