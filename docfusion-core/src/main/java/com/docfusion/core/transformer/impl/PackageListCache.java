package com.docfusion.core.transformer.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fetches and parses package lists of external documentation.
 *
 * <p>Accepts both the {@code package-list} format (one package per line) and the
 * {@code element-list} format, whose {@code module:} lines are skipped. With a cache directory,
 * each list is stored under a file name derived from its URL and read from there on later
 * runs.
 */
class PackageListCache {

    private static final Logger log = LoggerFactory.getLogger(PackageListCache.class);

    static final String CACHE_SUBDIRECTORY = "package-lists";
    private static final String MODULE_PREFIX = "module:";

    private final Path cacheDirectory;

    /**
     * Creates a cache.
     *
     * @param cacheRoot cache root, or {@code null} to fetch every list on every run
     */
    PackageListCache(Path cacheRoot) {
        this.cacheDirectory = cacheRoot == null ? null : cacheRoot.resolve(CACHE_SUBDIRECTORY);
    }

    /**
     * Returns the packages listed at a URL.
     *
     * @param packageListUrl URL of the package list
     * @return listed packages in file order
     * @throws IOException if the list can neither be read from the cache nor fetched
     */
    Set<String> packages(String packageListUrl) throws IOException {
        Path cached = cacheDirectory == null ? null : cacheDirectory.resolve(cacheFileName(packageListUrl));
        if (cached != null && Files.isRegularFile(cached)) {
            log.debug("Reading package list {} from cache {}", packageListUrl, cached);
            return parse(Files.readString(cached));
        }

        String content = fetch(packageListUrl);
        if (cached != null) {
            Files.createDirectories(cacheDirectory);
            Files.writeString(cached, content);
            log.debug("Cached package list {} at {}", packageListUrl, cached);
        }
        return parse(content);
    }

    static String cacheFileName(String url) {
        return url.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    static Set<String> parse(String content) {
        Set<String> packages = new LinkedHashSet<>();
        content.lines()
            .map(String::strip)
            .filter(line -> !line.isEmpty() && !line.startsWith(MODULE_PREFIX))
            .forEach(packages::add);
        return packages;
    }

    private static String fetch(String url) throws IOException {
        log.debug("Fetching package list {}", url);
        try (InputStream in = URI.create(url).toURL().openStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid package list URL: " + url, e);
        }
    }
}
