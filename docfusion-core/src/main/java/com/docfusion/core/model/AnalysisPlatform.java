package com.docfusion.core.model;

import java.util.Locale;

/**
 * Kind of runtime a platform pass is analyzed for.
 */
public enum AnalysisPlatform {
    JVM("jvm"),
    JS("js"),
    NATIVE("native"),
    COMMON("common");

    private final String key;

    AnalysisPlatform(String key) {
        this.key = key;
    }

    /**
     * Returns the lowercase configuration key of this platform (e.g. "jvm").
     *
     * @return configuration key
     */
    public String key() {
        return key;
    }

    /**
     * Parses a configuration value into a platform.
     *
     * <p>Matching is case-insensitive. A {@code null} or blank value yields {@link #JVM},
     * the platform used when a pass does not name one.
     *
     * @param value configuration value
     * @return matching platform
     * @throws IllegalArgumentException if the value names no known platform
     */
    public static AnalysisPlatform fromString(String value) {
        if (value == null || value.isBlank()) {
            return JVM;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AnalysisPlatform platform : values()) {
            if (platform.key.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown analysis platform: " + value);
    }
}
