package com.docfusion.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * One documented program element: package, class, function, property and so on.
 *
 * <p>Platform-specific data lives in {@link #facts()}, keyed by the platform that contributed
 * it. A documentable analyzed on a single platform has exactly one entry; after merging, a
 * declaration available on several platforms carries one entry per platform.
 *
 * <p>The parent reference is the parent's id only. Parents own their children; children
 * never hold their parent, so trees stay acyclic and can be rebuilt bottom-up.
 *
 * @param id identity key, unique among siblings
 * @param name simple display name
 * @param kind element kind
 * @param facts per-platform facts, in insertion order
 * @param children owned child declarations, in insertion order
 * @param parent id of the owning declaration, or {@code null} for packages
 */
public record Documentable(
    DocumentableId id,
    String name,
    DocumentableKind kind,
    Map<PlatformData, PlatformFacts> facts,
    List<Documentable> children,
    DocumentableId parent
) {
    /**
     * Compact constructor with validation.
     */
    public Documentable {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        facts = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        children = children == null ? List.of() : List.copyOf(children);
        requireUniqueIds(children, id);
    }

    /**
     * Returns the platforms this declaration is available on, in fact order.
     *
     * @return ordered platform set
     */
    public Set<PlatformData> platforms() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(facts.keySet()));
    }

    /**
     * Returns the facts recorded for the given platform.
     *
     * @param platform platform to look up
     * @return facts, or empty if the declaration is not available on that platform
     */
    public Optional<PlatformFacts> factsFor(PlatformData platform) {
        return Optional.ofNullable(facts.get(platform));
    }

    /**
     * Finds a direct child by id.
     *
     * @param childId id to look for
     * @return matching child, if present
     */
    public Optional<Documentable> child(DocumentableId childId) {
        return children.stream().filter(c -> c.id().equals(childId)).findFirst();
    }

    /**
     * Returns a copy with different children.
     *
     * @param newChildren replacement children
     * @return new documentable
     */
    public Documentable withChildren(List<Documentable> newChildren) {
        return new Documentable(id, name, kind, facts, newChildren, parent);
    }

    /**
     * Returns a copy with different facts.
     *
     * @param newFacts replacement facts
     * @return new documentable
     */
    public Documentable withFacts(Map<PlatformData, PlatformFacts> newFacts) {
        return new Documentable(id, name, kind, newFacts, children, parent);
    }

    /**
     * Returns a copy whose facts for every platform have been passed through the operator.
     *
     * @param operator facts mapping
     * @return new documentable
     */
    public Documentable mapFacts(UnaryOperator<PlatformFacts> operator) {
        Map<PlatformData, PlatformFacts> mapped = new LinkedHashMap<>();
        facts.forEach((platform, value) -> mapped.put(platform, operator.apply(value)));
        return withFacts(mapped);
    }

    static void requireUniqueIds(List<Documentable> children, Object owner) {
        Set<DocumentableId> seen = new LinkedHashSet<>();
        for (Documentable child : children) {
            if (!seen.add(child.id())) {
                throw new IllegalArgumentException(
                    "Duplicate child id " + child.id() + " under " + owner);
            }
        }
    }
}
