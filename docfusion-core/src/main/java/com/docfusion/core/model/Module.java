package com.docfusion.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Root of a documentation tree.
 *
 * <p>A module produced by a translator covers one platform and carries that platform as its
 * only facts key. A merged module carries one key per contributing platform. Packages are
 * owned exclusively by their module.
 *
 * @param name module name
 * @param facts module-level facts per platform
 * @param packages package documentables, in insertion order
 */
public record Module(
    String name,
    Map<PlatformData, PlatformFacts> facts,
    List<Documentable> packages
) {
    /**
     * Compact constructor with validation.
     */
    public Module {
        Objects.requireNonNull(name, "name must not be null");
        facts = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        packages = packages == null ? List.of() : List.copyOf(packages);
        for (Documentable pkg : packages) {
            if (pkg.kind() != DocumentableKind.PACKAGE) {
                throw new IllegalArgumentException(
                    "Module " + name + " may only own packages, got " + pkg.kind() + " " + pkg.id());
            }
        }
        Documentable.requireUniqueIds(packages, name);
    }

    /**
     * Creates an empty module for a single platform.
     *
     * @param name module name
     * @param platform platform the module was translated for
     * @return module without packages
     */
    public static Module empty(String name, PlatformData platform) {
        return new Module(name, Map.of(platform, PlatformFacts.empty()), List.of());
    }

    /**
     * Returns the platforms this module covers, in fact order.
     *
     * @return ordered platform set
     */
    public Set<PlatformData> platforms() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(facts.keySet()));
    }

    /**
     * Finds a package by its qualified name.
     *
     * @param packageName dotted package name (empty for the root package)
     * @return matching package, if present
     */
    public Optional<Documentable> findPackage(String packageName) {
        DocumentableId id = DocumentableId.of(packageName);
        return packages.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    /**
     * Returns a copy with different packages.
     *
     * @param newPackages replacement packages
     * @return new module
     */
    public Module withPackages(List<Documentable> newPackages) {
        return new Module(name, facts, newPackages);
    }
}
