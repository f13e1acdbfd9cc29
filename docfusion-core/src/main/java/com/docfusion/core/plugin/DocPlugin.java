package com.docfusion.core.plugin;

import com.docfusion.core.config.DocFusionConfig;

import java.util.Set;

/**
 * Unit of extension: contributes implementations to extension points.
 *
 * <p>Plugins are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/com.docfusion.core.plugin.DocPlugin} or passed to the generator
 * explicitly. Implementations discovered through the service loader must have a public no-arg
 * constructor.
 *
 * <p><b>Ordering:</b> plugins install in discovery order unless {@link #dependsOn()} or
 * {@link #runsBefore()} say otherwise. Since registrations of equal order resolve in
 * registration order, plugin order decides transformer order.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * public class VersionBannerPlugin implements DocPlugin {
 *     public String id() { return "version-banner"; }
 *
 *     public Set<String> dependsOn() { return Set.of(BasePlugin.ID); }
 *
 *     public void install(ExtensionRegistry.Builder registry, DocFusionConfig config) {
 *         registry.register(CoreExtensions.PAGE_TRANSFORMER, new VersionBannerInstaller());
 *     }
 * }
 * }</pre>
 */
public interface DocPlugin {

    /**
     * Returns the unique identifier of this plugin.
     *
     * @return plugin ID (e.g., "base")
     */
    String id();

    /**
     * Returns ids of plugins that must install before this one.
     *
     * @return plugin ids; unknown ids are ignored with a warning
     */
    default Set<String> dependsOn() {
        return Set.of();
    }

    /**
     * Returns ids of plugins that must install after this one.
     *
     * @return plugin ids; unknown ids are ignored with a warning
     */
    default Set<String> runsBefore() {
        return Set.of();
    }

    /**
     * Registers this plugin's implementations.
     *
     * @param registry registry under construction
     * @param config run configuration
     */
    void install(ExtensionRegistry.Builder registry, DocFusionConfig config);
}
