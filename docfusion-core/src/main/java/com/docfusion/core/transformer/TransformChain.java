package com.docfusion.core.transformer;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Left fold of an ordered transformer list over a value.
 */
public final class TransformChain {

    private TransformChain() {
        // Utility class
    }

    /**
     * Applies transformers in list order: the first receives {@code initial}, every later one
     * receives its predecessor's result.
     *
     * <p>An exception thrown by a transformer propagates immediately; the remaining transformers
     * do not run.
     *
     * @param initial starting value
     * @param transformers transformers in application order
     * @param step applies one transformer to the current value
     * @param <T> folded value type
     * @param <X> transformer type
     * @return result of the last transformer, or {@code initial} for an empty list
     * @throws NullPointerException if a transformer returns {@code null}
     */
    public static <T, X> T fold(T initial, List<X> transformers, BiFunction<X, T, T> step) {
        T current = initial;
        for (X transformer : transformers) {
            current = Objects.requireNonNull(step.apply(transformer, current),
                () -> transformer.getClass().getName() + " returned null");
        }
        return current;
    }
}
