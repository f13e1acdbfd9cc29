package com.docfusion.core.plugin;

import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.config.DocFusionConfig;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.exception.ConfigurationException;
import com.docfusion.core.logging.DocLogger;
import com.docfusion.core.model.PlatformData;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Run-wide context handed to every extension: configuration, logger, platforms and the frozen
 * extension registry.
 *
 * <p>Immutable once created. Creating a context checks that every required single point
 * resolves, so a missing or ambiguous core extension fails before any translation work.
 */
public final class DocContext {

    private final DocFusionConfig config;
    private final DocLogger logger;
    private final Map<PlatformData, PlatformContext> platforms;
    private final ExtensionRegistry registry;
    private final List<DocPlugin> plugins;

    /**
     * Creates a context.
     *
     * @param config run configuration
     * @param logger pipeline logger
     * @param platforms platform contexts in pass order
     * @param registry frozen registry
     * @param plugins installed plugins in installation order
     * @throws ConfigurationException if a required single point does not resolve to exactly one
     *         implementation
     */
    public DocContext(DocFusionConfig config,
                      DocLogger logger,
                      Map<PlatformData, PlatformContext> platforms,
                      ExtensionRegistry registry,
                      List<DocPlugin> plugins) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        this.platforms = platforms == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(platforms));
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.plugins = plugins == null ? List.of() : List.copyOf(plugins);

        for (ExtensionPoint<?> point : CoreExtensions.requiredSinglePoints()) {
            registry.resolveSingle(point);
        }
    }

    public DocFusionConfig config() {
        return config;
    }

    public DocLogger logger() {
        return logger;
    }

    public Map<PlatformData, PlatformContext> platforms() {
        return platforms;
    }

    public ExtensionRegistry registry() {
        return registry;
    }

    public List<DocPlugin> plugins() {
        return plugins;
    }

    /**
     * Resolves a single-cardinality point.
     *
     * @param point extension point
     * @param <T> implementation type
     * @return the implementation
     */
    public <T> T single(ExtensionPoint<T> point) {
        return registry.resolveSingle(point);
    }

    /**
     * Resolves all implementations of a point in order.
     *
     * @param point extension point
     * @param <T> implementation type
     * @return implementations
     */
    public <T> List<T> get(ExtensionPoint<T> point) {
        return registry.resolveAll(point);
    }

    /**
     * Finds the pass configuration a platform was built from.
     *
     * @param platform platform identity
     * @return pass configuration, if the platform belongs to this run
     */
    public Optional<PassConfig> passFor(PlatformData platform) {
        PlatformContext context = platforms.get(platform);
        if (context != null) {
            return Optional.of(context.pass());
        }
        return config.passes().stream()
            .filter(pass -> pass.platformData().equals(platform))
            .findFirst();
    }

    /**
     * Returns the directory relative paths in a platform's pass configuration resolve against.
     *
     * @param platform platform identity
     * @return the analysis base directory, or the working directory for platforms not
     *         analyzed in this run
     */
    public Path baseDirectoryFor(PlatformData platform) {
        PlatformContext context = platforms.get(platform);
        return context != null ? context.analysis().baseDirectory() : Path.of("").toAbsolutePath();
    }
}
