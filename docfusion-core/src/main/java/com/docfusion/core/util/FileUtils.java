package com.docfusion.core.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files under a root whose path relative to the root matches a glob pattern.
     *
     * <p>A file also matches when its file name alone matches, so {@code *.java} finds Java
     * files at any depth. Results are sorted by path so repeated runs see files in the same
     * order.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return sorted matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path))
                    || matcher.matches(path.getFileName()))
                .sorted()
                .toList();
        }
    }

    /**
     * Finds matching files in several roots, in root order.
     *
     * @param rootPaths root directories to search from
     * @param globPattern glob pattern
     * @return matching paths
     * @throws UncheckedIOException if a traversal fails
     */
    public static List<Path> findFiles(List<Path> rootPaths, String globPattern) {
        return rootPaths.stream()
            .filter(Files::isDirectory)
            .flatMap(rootPath -> {
                try {
                    return findFiles(rootPath, globPattern).stream();
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to walk " + rootPath, e);
                }
            })
            .toList();
    }

    /**
     * Converts a path to a string with forward slashes.
     *
     * @param path path to convert
     * @return Unix style path string
     */
    public static String toUnixPath(Path path) {
        return path.toString().replace('\\', '/');
    }

    /**
     * Resolves a configured path against a base directory and normalizes it.
     *
     * @param baseDirectory directory relative paths resolve against
     * @param path configured path, relative or absolute
     * @return absolute Unix style path string
     */
    public static String toAbsoluteUnixPath(Path baseDirectory, String path) {
        return toUnixPath(baseDirectory.resolve(path).toAbsolutePath().normalize());
    }
}
