package com.docfusion.core.analysis.impl;

import com.docfusion.core.analysis.AnalysisContext;
import com.docfusion.core.analysis.AnalysisEnvironmentFactory;
import com.docfusion.core.analysis.FrontEnd;
import com.docfusion.core.analysis.MessageCollector;
import com.docfusion.core.analysis.Severity;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.exception.AnalysisEnvironmentException;
import com.docfusion.core.model.AnalysisPlatform;
import com.docfusion.core.model.SourceLocation;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Default analysis environment backed by JavaParser and Jackson.
 *
 * <p>For every pass it:
 * <ul>
 *   <li>resolves source roots, classpath entries, samples and include files against a base
 *       directory</li>
 *   <li>fails if a classpath entry does not exist</li>
 *   <li>maps {@code languageVersion} to a JavaParser {@link LanguageLevel}</li>
 *   <li>fails if {@code apiVersion} is newer than {@code languageVersion}</li>
 *   <li>parses {@code *.java} files for JVM passes and reads {@code *.symbols.json}
 *       descriptors for every pass</li>
 * </ul>
 *
 * <p>Missing source roots are reported as warnings, not failures.
 */
public class JavaParserAnalysisEnvironmentFactory implements AnalysisEnvironmentFactory {

    private static final Logger log = LoggerFactory.getLogger(JavaParserAnalysisEnvironmentFactory.class);

    private final Path baseDirectory;

    public JavaParserAnalysisEnvironmentFactory(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public AnalysisContext create(PassConfig pass, MessageCollector collector) {
        AnalysisPlatform platform = pass.analysisPlatform();
        log.debug("Creating analysis environment for {} ({})", pass.moduleName(), platform.key());

        List<Path> classpath = resolveAll(pass.classpath());
        for (Path entry : classpath) {
            if (!Files.exists(entry)) {
                throw new AnalysisEnvironmentException(
                    "Classpath entry does not exist for pass " + pass.moduleName()
                        + " [" + platform.key() + "]: " + entry);
            }
        }

        List<Path> sourceRoots = resolveAll(pass.sourceRoots());
        for (Path root : sourceRoots) {
            if (!Files.isDirectory(root)) {
                collector.report(Severity.WARNING, "Source root does not exist: " + root,
                    new SourceLocation(root.toString(), 0));
            }
        }

        LanguageLevel languageLevel = languageLevel(pass.languageVersion());
        checkApiVersion(pass, languageLevel);
        ParserConfiguration parserConfiguration = new ParserConfiguration()
            .setLanguageLevel(languageLevel)
            .setAttributeComments(true);

        FrontEnd frontEnd = platform == AnalysisPlatform.JVM ? FrontEnd.JAVA_SOURCE : FrontEnd.SYMBOL_DESCRIPTORS;
        return new JavaParserAnalysisContext(
            frontEnd,
            baseDirectory,
            sourceRoots,
            resolveAll(pass.samples()),
            resolveAll(pass.includes()),
            parserConfiguration,
            collector
        );
    }

    /**
     * Maps a configured language version ("17", "1.8", "JAVA_11") to a JavaParser level.
     *
     * @param languageVersion configured version, or {@code null} for JavaParser's default
     * @return language level
     * @throws AnalysisEnvironmentException if the version is not supported
     */
    static LanguageLevel languageLevel(String languageVersion) {
        if (languageVersion == null || languageVersion.isBlank()) {
            return new ParserConfiguration().getLanguageLevel();
        }
        String normalized = languageVersion.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("JAVA_")) {
            normalized = normalized.substring("JAVA_".length());
        }
        if (normalized.matches("1\\.([5-9])")) {
            normalized = normalized.substring(2);
        }
        String constant = "JAVA_" + normalized.replace('.', '_');
        try {
            return LanguageLevel.valueOf(constant);
        } catch (IllegalArgumentException e) {
            throw new AnalysisEnvironmentException("Unsupported language version: " + languageVersion, e);
        }
    }

    /**
     * Rejects an API version newer than the language version the sources are parsed with.
     *
     * @param pass pass configuration
     * @param languageLevel resolved language level
     * @throws AnalysisEnvironmentException if the API version is unsupported or too new
     */
    static void checkApiVersion(PassConfig pass, LanguageLevel languageLevel) {
        if (pass.apiVersion() == null || pass.apiVersion().isBlank()) {
            return;
        }
        LanguageLevel apiLevel = languageLevel(pass.apiVersion());
        boolean languageSet = pass.languageVersion() != null && !pass.languageVersion().isBlank();
        if (languageSet && apiLevel.compareTo(languageLevel) > 0) {
            throw new AnalysisEnvironmentException("API version " + pass.apiVersion()
                + " is newer than language version " + pass.languageVersion()
                + " for pass " + pass.moduleName() + " [" + pass.platform() + "]");
        }
    }

    private List<Path> resolveAll(List<String> paths) {
        return paths.stream()
            .map(baseDirectory::resolve)
            .map(Path::normalize)
            .toList();
    }
}
