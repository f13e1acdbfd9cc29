package com.docfusion.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rendered files below an output directory.
 *
 * <p>Creates the directory structure automatically, preserves relative paths and overwrites
 * existing files. A path escaping the output directory is rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * FileSystemWriter writer = new FileSystemWriter(Path.of("./build/docs"));
 * writer.write(List.of(new GeneratedFile("com/example/Cache.md", "# Cache")));
 * // Creates: ./build/docs/com/example/Cache.md
 * }</pre>
 */
public class FileSystemWriter {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemWriter.class);

    private final Path outputDir;

    public FileSystemWriter(Path outputDir) {
        this.outputDir = outputDir.toAbsolutePath().normalize();
    }

    /**
     * Writes files in order.
     *
     * @param files files to write
     * @throws IllegalStateException if a directory or file cannot be written
     */
    public void write(List<GeneratedFile> files) {
        logger.info("Writing {} files to: {}", files.size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : files) {
            writeFile(file);
        }
    }

    public Path outputDir() {
        return outputDir;
    }

    private void writeFile(GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("Refusing to write outside the output directory: " + file.relativePath());
        }
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content());
            logger.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
