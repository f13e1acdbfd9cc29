package com.docfusion.core;

import com.docfusion.core.analysis.LoggingMessageCollector;
import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.analysis.impl.JavaParserAnalysisEnvironmentFactory;
import com.docfusion.core.config.PassConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for tests that analyze a source tree on disk.
 *
 * <p>Provides a temporary project directory, helpers for writing files into it and a
 * JavaParser-backed analysis of a pass rooted there.
 */
public abstract class SourceTreeTestBase {

    @TempDir
    protected Path tempDir;

    protected RecordingDocLogger logger;

    @BeforeEach
    void setUpLogger() {
        logger = new RecordingDocLogger();
    }

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "src/com/example/Cache.java")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Analyzes a pass whose paths are relative to the temp directory.
     *
     * @param pass pass configuration
     * @return platform context of the pass
     */
    protected PlatformContext analyze(PassConfig pass) {
        JavaParserAnalysisEnvironmentFactory factory = new JavaParserAnalysisEnvironmentFactory(tempDir);
        return new PlatformContext(pass.platformData(), pass,
            factory.create(pass, new LoggingMessageCollector(logger)));
    }
}
