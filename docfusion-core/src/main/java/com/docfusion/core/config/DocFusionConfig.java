package com.docfusion.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of a documentation run.
 *
 * <p>Loaded from {@code docfusion.yaml}. Holds global output settings and one
 * {@link PassConfig} per platform pass.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * outputDir: "./build/docs"
 * format: markdown
 * generateIndexPages: true
 *
 * passes:
 *   - moduleName: "cache"
 *     platform: jvm
 *     sourceRoots: ["src/jvmMain/java"]
 *     classpath: ["libs/annotations.jar"]
 *     perPackageOptions:
 *       - prefix: "com.example.cache.internal"
 *         suppress: true
 *   - moduleName: "cache"
 *     platform: js
 *     sourceRoots: ["build/symbols/js"]
 * }</pre>
 *
 * @param outputDir output directory
 * @param format output format; selects the renderer (default "markdown")
 * @param cacheRoot optional cache directory for analysis collaborators
 * @param generateIndexPages whether to generate an alphabetical index page
 * @param parallelism maximum number of platforms translated concurrently
 * @param failOnAnalysisError whether analysis errors should fail the caller's exit code
 * @param passes platform passes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocFusionConfig(
    @JsonProperty("outputDir") String outputDir,
    @JsonProperty("format") String format,
    @JsonProperty("cacheRoot") String cacheRoot,
    @JsonProperty("generateIndexPages") Boolean generateIndexPages,
    @JsonProperty("parallelism") Integer parallelism,
    @JsonProperty("failOnAnalysisError") Boolean failOnAnalysisError,
    @JsonProperty("passes") List<PassConfig> passes
) {
    public static final String DEFAULT_OUTPUT_DIR = "./build/docs";
    public static final String DEFAULT_FORMAT = "markdown";

    /**
     * Compact constructor applying defaults.
     */
    public DocFusionConfig {
        if (outputDir == null || outputDir.isBlank()) {
            outputDir = DEFAULT_OUTPUT_DIR;
        }
        if (format == null || format.isBlank()) {
            format = DEFAULT_FORMAT;
        }
        if (generateIndexPages == null) {
            generateIndexPages = false;
        }
        if (parallelism == null) {
            parallelism = Runtime.getRuntime().availableProcessors();
        }
        if (failOnAnalysisError == null) {
            failOnAnalysisError = false;
        }
        passes = passes == null ? List.of() : List.copyOf(passes);
    }

    /**
     * Creates the default configuration: one JVM pass over {@code src/main/java}.
     *
     * @return default configuration
     */
    public static DocFusionConfig defaults() {
        return new DocFusionConfig(
            DEFAULT_OUTPUT_DIR,
            DEFAULT_FORMAT,
            null,
            false,
            null,
            false,
            List.of(PassConfig.forSources("root", "jvm", List.of("src/main/java")))
        );
    }

    /**
     * Returns a copy with a different output directory.
     *
     * @param newOutputDir output directory
     * @return new configuration
     */
    public DocFusionConfig withOutputDir(String newOutputDir) {
        return new DocFusionConfig(newOutputDir, format, cacheRoot, generateIndexPages,
            parallelism, failOnAnalysisError, passes);
    }

    /**
     * Returns a copy with a different output format.
     *
     * @param newFormat output format
     * @return new configuration
     */
    public DocFusionConfig withFormat(String newFormat) {
        return new DocFusionConfig(outputDir, newFormat, cacheRoot, generateIndexPages,
            parallelism, failOnAnalysisError, passes);
    }

    /**
     * Returns a copy with different passes.
     *
     * @param newPasses platform passes
     * @return new configuration
     */
    public DocFusionConfig withPasses(List<PassConfig> newPasses) {
        return new DocFusionConfig(outputDir, format, cacheRoot, generateIndexPages,
            parallelism, failOnAnalysisError, newPasses);
    }
}
