package com.docfusion.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Identity of one analysis target.
 *
 * <p>Used as the key of every per-platform mapping in the documentation model, so equality
 * is structural over all three components.
 *
 * @param name pass name (usually the module name plus platform, e.g. "core-jvm")
 * @param platform runtime kind of the pass
 * @param targets logical sub-targets of the pass, in configuration order
 */
public record PlatformData(
    String name,
    AnalysisPlatform platform,
    List<String> targets
) {
    /**
     * Compact constructor with validation.
     */
    public PlatformData {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    /**
     * Creates platform data without sub-targets.
     *
     * @param name pass name
     * @param platform runtime kind
     * @return platform data
     */
    public static PlatformData of(String name, AnalysisPlatform platform) {
        return new PlatformData(name, platform, List.of());
    }

    @Override
    public String toString() {
        return targets.isEmpty()
            ? name + "[" + platform.key() + "]"
            : name + "[" + platform.key() + ":" + String.join(",", targets) + "]";
    }
}
