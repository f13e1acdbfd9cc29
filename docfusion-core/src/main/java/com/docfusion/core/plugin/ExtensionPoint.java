package com.docfusion.core.plugin;

import java.util.Objects;

/**
 * Typed token identifying a slot plugins contribute implementations to.
 *
 * @param name stable point name, unique per run
 * @param type implementation type
 * @param cardinality single or multi
 * @param <T> implementation type
 */
public record ExtensionPoint<T>(
    String name,
    Class<T> type,
    Cardinality cardinality
) {
    /**
     * Compact constructor with validation.
     */
    public ExtensionPoint {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(cardinality, "cardinality must not be null");
    }

    /**
     * Creates a point that takes exactly one implementation.
     *
     * @param name point name
     * @param type implementation type
     * @param <T> implementation type
     * @return extension point
     */
    public static <T> ExtensionPoint<T> single(String name, Class<T> type) {
        return new ExtensionPoint<>(name, type, Cardinality.SINGLE);
    }

    /**
     * Creates a point that takes an ordered list of implementations.
     *
     * @param name point name
     * @param type implementation type
     * @param <T> implementation type
     * @return extension point
     */
    public static <T> ExtensionPoint<T> multi(String name, Class<T> type) {
        return new ExtensionPoint<>(name, type, Cardinality.MULTI);
    }

    @Override
    public String toString() {
        return name + "<" + type.getSimpleName() + ", " + cardinality + ">";
    }
}
