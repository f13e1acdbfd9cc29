package com.docfusion.core.config;

import com.docfusion.core.model.AnalysisPlatform;
import com.docfusion.core.model.PlatformData;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Configuration of one platform pass.
 *
 * @param moduleName documented module name
 * @param platform platform key: jvm, js, native or common (default jvm)
 * @param targets logical sub-targets of the platform
 * @param sourceRoots directories holding the sources of this pass
 * @param classpath classpath entries the analysis resolves against
 * @param samples sample source paths
 * @param includes extra documentation files
 * @param languageVersion source language version, analyzer specific
 * @param apiVersion API version, analyzer specific
 * @param includeNonPublic whether non-public declarations are documented
 * @param reportUndocumented whether undocumented public declarations are reported
 * @param skipDeprecated whether deprecated declarations are dropped
 * @param skipEmptyPackages whether packages without declarations are dropped
 * @param suppressedFiles source files whose declarations are dropped
 * @param perPackageOptions options overriding the pass defaults for package prefixes
 * @param externalDocumentationLinks links to documentation of external libraries
 * @param sourceLinks mappings from local source directories to browsable URLs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PassConfig(
    @JsonProperty("moduleName") String moduleName,
    @JsonProperty("platform") String platform,
    @JsonProperty("targets") List<String> targets,
    @JsonProperty("sourceRoots") List<String> sourceRoots,
    @JsonProperty("classpath") List<String> classpath,
    @JsonProperty("samples") List<String> samples,
    @JsonProperty("includes") List<String> includes,
    @JsonProperty("languageVersion") String languageVersion,
    @JsonProperty("apiVersion") String apiVersion,
    @JsonProperty("includeNonPublic") Boolean includeNonPublic,
    @JsonProperty("reportUndocumented") Boolean reportUndocumented,
    @JsonProperty("skipDeprecated") Boolean skipDeprecated,
    @JsonProperty("skipEmptyPackages") Boolean skipEmptyPackages,
    @JsonProperty("suppressedFiles") List<String> suppressedFiles,
    @JsonProperty("perPackageOptions") List<PackageOptions> perPackageOptions,
    @JsonProperty("externalDocumentationLinks") List<ExternalDocumentationLink> externalDocumentationLinks,
    @JsonProperty("sourceLinks") List<SourceLink> sourceLinks
) {
    /**
     * Compact constructor applying defaults.
     */
    public PassConfig {
        if (platform == null || platform.isBlank()) {
            platform = AnalysisPlatform.JVM.key();
        }
        targets = targets == null ? List.of() : List.copyOf(targets);
        sourceRoots = sourceRoots == null ? List.of() : List.copyOf(sourceRoots);
        classpath = classpath == null ? List.of() : List.copyOf(classpath);
        samples = samples == null ? List.of() : List.copyOf(samples);
        includes = includes == null ? List.of() : List.copyOf(includes);
        if (includeNonPublic == null) {
            includeNonPublic = false;
        }
        if (reportUndocumented == null) {
            reportUndocumented = true;
        }
        if (skipDeprecated == null) {
            skipDeprecated = false;
        }
        if (skipEmptyPackages == null) {
            skipEmptyPackages = true;
        }
        suppressedFiles = suppressedFiles == null ? List.of() : List.copyOf(suppressedFiles);
        perPackageOptions = perPackageOptions == null ? List.of() : List.copyOf(perPackageOptions);
        externalDocumentationLinks = externalDocumentationLinks == null
            ? List.of() : List.copyOf(externalDocumentationLinks);
        sourceLinks = sourceLinks == null ? List.of() : List.copyOf(sourceLinks);
    }

    /**
     * Creates a pass with source roots and defaults for everything else.
     *
     * @param moduleName module name
     * @param platform platform key
     * @param sourceRoots source roots
     * @return pass configuration
     */
    public static PassConfig forSources(String moduleName, String platform, List<String> sourceRoots) {
        return new PassConfig(moduleName, platform, null, sourceRoots, null, null, null, null, null,
            null, null, null, null, null, null, null, null);
    }

    /**
     * Returns the parsed platform kind.
     *
     * @return analysis platform
     * @throws IllegalArgumentException if the platform key is unknown
     */
    public AnalysisPlatform analysisPlatform() {
        return AnalysisPlatform.fromString(platform);
    }

    /**
     * Returns the platform identity of this pass.
     *
     * @return platform data
     */
    public PlatformData platformData() {
        return new PlatformData(moduleName, analysisPlatform(), targets);
    }

    /**
     * Finds the package options that apply to a package: the entry with the longest prefix
     * matching the package name on a segment boundary.
     *
     * @param packageName dotted package name
     * @return matching options, if any
     */
    public Optional<PackageOptions> packageOptionsFor(String packageName) {
        return perPackageOptions.stream()
            .filter(options -> options.matches(packageName))
            .max(Comparator.comparingInt(options -> options.prefix().length()));
    }

    public boolean includeNonPublicFor(String packageName) {
        return packageOptionsFor(packageName)
            .map(PackageOptions::includeNonPublic)
            .orElse(includeNonPublic);
    }

    public boolean skipDeprecatedFor(String packageName) {
        return packageOptionsFor(packageName)
            .map(PackageOptions::skipDeprecated)
            .orElse(skipDeprecated);
    }

    public boolean reportUndocumentedFor(String packageName) {
        return packageOptionsFor(packageName)
            .map(PackageOptions::reportUndocumented)
            .orElse(reportUndocumented);
    }

    public boolean suppressedPackage(String packageName) {
        return packageOptionsFor(packageName)
            .map(PackageOptions::suppress)
            .orElse(false);
    }

    /**
     * Options applying to all packages starting with a prefix.
     *
     * @param prefix package prefix
     * @param includeNonPublic whether non-public declarations are documented
     * @param reportUndocumented whether undocumented declarations are reported
     * @param skipDeprecated whether deprecated declarations are dropped
     * @param suppress whether matching packages are dropped entirely
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PackageOptions(
        @JsonProperty("prefix") String prefix,
        @JsonProperty("includeNonPublic") Boolean includeNonPublic,
        @JsonProperty("reportUndocumented") Boolean reportUndocumented,
        @JsonProperty("skipDeprecated") Boolean skipDeprecated,
        @JsonProperty("suppress") Boolean suppress
    ) {
        public PackageOptions {
            if (prefix == null) {
                prefix = "";
            }
            if (includeNonPublic == null) {
                includeNonPublic = false;
            }
            if (reportUndocumented == null) {
                reportUndocumented = true;
            }
            if (skipDeprecated == null) {
                skipDeprecated = false;
            }
            if (suppress == null) {
                suppress = false;
            }
        }

        /**
         * Returns true if the package equals the prefix or lies below it.
         *
         * @param packageName dotted package name
         * @return true if these options apply
         */
        public boolean matches(String packageName) {
            return prefix.isEmpty()
                || packageName.equals(prefix)
                || packageName.startsWith(prefix + ".");
        }
    }

    /**
     * Link to the published documentation of an external library.
     *
     * @param url documentation root URL
     * @param packageListUrl URL of the package list, defaults to {@code url + "package-list"}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExternalDocumentationLink(
        @JsonProperty("url") String url,
        @JsonProperty("packageListUrl") String packageListUrl
    ) {
        public ExternalDocumentationLink {
            if (packageListUrl == null && url != null) {
                packageListUrl = url.endsWith("/") ? url + "package-list" : url + "/package-list";
            }
        }
    }

    /**
     * Maps a local source directory to a browsable URL.
     *
     * @param path local directory, Unix separators only
     * @param url remote URL of the same directory
     * @param lineSuffix suffix appended before a line number (e.g. "#L")
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceLink(
        @JsonProperty("path") String path,
        @JsonProperty("url") String url,
        @JsonProperty("lineSuffix") String lineSuffix
    ) {}
}
