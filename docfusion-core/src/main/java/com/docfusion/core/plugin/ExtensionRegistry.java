package com.docfusion.core.plugin;

import com.docfusion.core.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from extension points to the implementations plugins registered.
 *
 * <p>Built once by {@link Builder#build()} during plugin initialization and read-only
 * afterwards, so concurrent reads from the parallel translation stage need no locking.
 *
 * <p><b>Ordering:</b> implementations of a point resolve in ascending explicit order (default
 * {@code 0}); equal orders keep registration order, which follows plugin initialization order.
 *
 * <p><b>Overrides:</b> if any registration of a point is an override, only override
 * registrations of that point are kept.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ExtensionRegistry registry = ExtensionRegistry.builder()
 *     .register(CoreExtensions.RENDERER, new MarkdownRenderer(outputDir))
 *     .register(CoreExtensions.PAGE_TRANSFORMER, new NavigationPageInstaller())
 *     .build();
 *
 * Renderer renderer = registry.resolveSingle(CoreExtensions.RENDERER);
 * }</pre>
 */
public final class ExtensionRegistry {

    private final Map<ExtensionPoint<?>, List<Registration>> registrations;

    private ExtensionRegistry(Map<ExtensionPoint<?>, List<Registration>> registrations) {
        this.registrations = registrations;
    }

    /**
     * Creates an empty builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the only implementation of a point.
     *
     * @param point extension point
     * @param <T> implementation type
     * @return the registered implementation
     * @throws ConfigurationException if zero or more than one implementation is registered
     */
    public <T> T resolveSingle(ExtensionPoint<T> point) {
        List<Registration> found = registrations.getOrDefault(point, List.of());
        if (found.size() != 1) {
            throw new ConfigurationException(
                "Expected exactly one implementation for extension point '" + point.name()
                    + "', found " + found.size() + describe(found));
        }
        return point.type().cast(found.get(0).implementation());
    }

    /**
     * Resolves every implementation of a point in resolution order.
     *
     * @param point extension point
     * @param <T> implementation type
     * @return ordered implementations; empty if none are registered
     */
    public <T> List<T> resolveAll(ExtensionPoint<T> point) {
        return registrations.getOrDefault(point, List.of()).stream()
            .map(registration -> point.type().cast(registration.implementation()))
            .toList();
    }

    /**
     * Returns every point that has at least one registration, in first-registration order.
     *
     * @return extension points
     */
    public Set<ExtensionPoint<?>> points() {
        return Collections.unmodifiableSet(registrations.keySet());
    }

    /**
     * Returns the registrations of a point, for diagnostics and listings.
     *
     * @param point extension point
     * @return resolved registrations
     */
    public List<Registration> registrationsOf(ExtensionPoint<?> point) {
        return registrations.getOrDefault(point, List.of());
    }

    private static String describe(List<Registration> found) {
        if (found.isEmpty()) {
            return "";
        }
        List<String> names = found.stream()
            .map(r -> r.pluginId() + ":" + r.implementation().getClass().getName())
            .toList();
        return " " + names;
    }

    /**
     * One contributed implementation.
     *
     * @param point extension point
     * @param implementation implementation instance
     * @param order explicit order; lower resolves first
     * @param override whether this registration replaces non-override registrations
     * @param pluginId id of the contributing plugin
     * @param sequence global registration sequence number
     */
    public record Registration(
        ExtensionPoint<?> point,
        Object implementation,
        int order,
        boolean override,
        String pluginId,
        int sequence
    ) {}

    /**
     * Collects registrations. Not thread-safe; used by the single initialization thread.
     */
    public static final class Builder {

        static final String DIRECT = "<direct>";

        private final List<Registration> pending = new ArrayList<>();
        private String currentPlugin = DIRECT;
        private boolean built;

        private Builder() {
        }

        /**
         * Registers an implementation with the default order.
         *
         * @param point extension point
         * @param implementation implementation instance
         * @param <T> implementation type
         * @return this builder
         */
        public <T> Builder register(ExtensionPoint<T> point, T implementation) {
            return register(point, implementation, 0);
        }

        /**
         * Registers an implementation with an explicit order.
         *
         * @param point extension point
         * @param implementation implementation instance
         * @param order explicit order; lower resolves first, ties keep registration order
         * @param <T> implementation type
         * @return this builder
         */
        public <T> Builder register(ExtensionPoint<T> point, T implementation, int order) {
            return add(point, implementation, order, false);
        }

        /**
         * Registers an implementation that replaces every non-override registration of the
         * point, whichever plugin made it and whenever it was made.
         *
         * @param point extension point
         * @param implementation implementation instance
         * @param <T> implementation type
         * @return this builder
         */
        public <T> Builder override(ExtensionPoint<T> point, T implementation) {
            return add(point, implementation, 0, true);
        }

        void forPlugin(String pluginId) {
            this.currentPlugin = pluginId == null ? DIRECT : pluginId;
        }

        /**
         * Freezes the registrations into a registry. The builder cannot be used afterwards.
         *
         * @return immutable registry
         */
        public ExtensionRegistry build() {
            if (built) {
                throw new IllegalStateException("ExtensionRegistry.Builder has already been built");
            }
            built = true;

            Map<ExtensionPoint<?>, List<Registration>> grouped = new LinkedHashMap<>();
            for (Registration registration : pending) {
                grouped.computeIfAbsent(registration.point(), p -> new ArrayList<>()).add(registration);
            }

            Map<ExtensionPoint<?>, List<Registration>> resolved = new LinkedHashMap<>();
            grouped.forEach((point, list) -> {
                boolean hasOverride = list.stream().anyMatch(Registration::override);
                List<Registration> kept = list.stream()
                    .filter(r -> !hasOverride || r.override())
                    .sorted(Comparator.comparingInt(Registration::order)
                        .thenComparingInt(Registration::sequence))
                    .toList();
                resolved.put(point, kept);
            });
            return new ExtensionRegistry(Collections.unmodifiableMap(resolved));
        }

        private <T> Builder add(ExtensionPoint<T> point, T implementation, int order, boolean override) {
            if (built) {
                throw new IllegalStateException("ExtensionRegistry is read-only once built");
            }
            Objects.requireNonNull(point, "point must not be null");
            Objects.requireNonNull(implementation, "implementation must not be null");
            if (!point.type().isInstance(implementation)) {
                throw new ConfigurationException("Implementation " + implementation.getClass().getName()
                    + " is not a " + point.type().getName() + " (point '" + point.name() + "')");
            }
            pending.add(new Registration(point, implementation, order, override, currentPlugin, pending.size()));
            return this;
        }
    }
}
