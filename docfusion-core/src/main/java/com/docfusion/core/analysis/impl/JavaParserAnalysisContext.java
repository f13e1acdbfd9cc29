package com.docfusion.core.analysis.impl;

import com.docfusion.core.analysis.AnalysisContext;
import com.docfusion.core.analysis.AnalyzedSourceFile;
import com.docfusion.core.analysis.FrontEnd;
import com.docfusion.core.analysis.IncludedDocumentation;
import com.docfusion.core.analysis.MessageCollector;
import com.docfusion.core.analysis.Severity;
import com.docfusion.core.analysis.SymbolGroup;
import com.docfusion.core.model.SourceLocation;
import com.docfusion.core.util.FileUtils;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Analysis context of one pass, parsing lazily on first access.
 *
 * <p>Files that cannot be read or parsed are reported to the message collector as errors
 * and skipped. Only a failure to walk a source root is fatal for the translating stage.
 */
class JavaParserAnalysisContext implements AnalysisContext {

    private static final Logger log = LoggerFactory.getLogger(JavaParserAnalysisContext.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    static final String JAVA_PATTERN = "*.java";
    static final String SYMBOLS_PATTERN = "*.symbols.json";

    private final FrontEnd frontEnd;
    private final Path baseDirectory;
    private final List<Path> sourceRoots;
    private final List<Path> samples;
    private final List<Path> includes;
    private final JavaParser javaParser;
    private final MessageCollector collector;

    private List<AnalyzedSourceFile> sourceFiles;
    private List<AnalyzedSourceFile> sampleFiles;
    private List<SymbolGroup> symbolGroups;
    private List<IncludedDocumentation> includedDocumentation;

    JavaParserAnalysisContext(
            FrontEnd frontEnd,
            Path baseDirectory,
            List<Path> sourceRoots,
            List<Path> samples,
            List<Path> includes,
            ParserConfiguration parserConfiguration,
            MessageCollector collector) {
        this.frontEnd = frontEnd;
        this.baseDirectory = baseDirectory;
        this.sourceRoots = List.copyOf(sourceRoots);
        this.samples = List.copyOf(samples);
        this.includes = List.copyOf(includes);
        this.javaParser = new JavaParser(parserConfiguration);
        this.collector = collector;
    }

    @Override
    public FrontEnd frontEnd() {
        return frontEnd;
    }

    @Override
    public Path baseDirectory() {
        return baseDirectory;
    }

    @Override
    public synchronized List<AnalyzedSourceFile> sourceFiles() {
        if (sourceFiles == null) {
            sourceFiles = frontEnd == FrontEnd.JAVA_SOURCE
                ? parseAll(FileUtils.findFiles(sourceRoots, JAVA_PATTERN)) : List.of();
            log.debug("Parsed {} Java file(s) from {}", sourceFiles.size(), sourceRoots);
        }
        return sourceFiles;
    }

    @Override
    public synchronized List<AnalyzedSourceFile> sampleFiles() {
        if (sampleFiles == null) {
            sampleFiles = frontEnd == FrontEnd.JAVA_SOURCE ? parseAll(sampleSources()) : List.of();
        }
        return sampleFiles;
    }

    @Override
    public synchronized List<SymbolGroup> symbolGroups() {
        if (symbolGroups == null) {
            symbolGroups = readSymbolGroups();
        }
        return symbolGroups;
    }

    @Override
    public synchronized List<IncludedDocumentation> includedDocumentation() {
        if (includedDocumentation == null) {
            includedDocumentation = readIncludes();
        }
        return includedDocumentation;
    }

    @Override
    public MessageCollector messageCollector() {
        return collector;
    }

    private List<AnalyzedSourceFile> parseAll(List<Path> files) {
        List<AnalyzedSourceFile> parsed = new ArrayList<>();
        for (Path file : files) {
            Optional<String> content = read(file);
            if (content.isEmpty()) {
                continue;
            }
            ParseResult<CompilationUnit> result = javaParser.parse(content.get());

            if (result.isSuccessful() && result.getResult().isPresent()) {
                parsed.add(new AnalyzedSourceFile(file, result.getResult().get()));
            } else {
                for (Problem problem : result.getProblems()) {
                    int line = problem.getLocation()
                        .flatMap(location -> location.getBegin().getRange())
                        .map(range -> range.begin.line)
                        .orElse(0);
                    collector.report(Severity.ERROR, problem.getMessage(),
                        new SourceLocation(FileUtils.toUnixPath(file), line));
                }
            }
        }
        return parsed;
    }

    private List<Path> sampleSources() {
        List<Path> files = new ArrayList<>();
        for (Path sample : samples) {
            if (Files.isRegularFile(sample)) {
                files.add(sample);
            } else if (Files.isDirectory(sample)) {
                files.addAll(FileUtils.findFiles(List.of(sample), JAVA_PATTERN));
            } else {
                collector.report(Severity.WARNING, "Sample path does not exist: " + sample, null);
            }
        }
        return files;
    }

    private List<SymbolGroup> readSymbolGroups() {
        List<SymbolGroup> groups = new ArrayList<>();
        for (Path file : FileUtils.findFiles(sourceRoots, SYMBOLS_PATTERN)) {
            try {
                groups.add(JSON_MAPPER.readValue(file.toFile(), SymbolGroup.class));
            } catch (JacksonException e) {
                collector.report(Severity.ERROR, "Invalid symbol descriptor: " + e.getOriginalMessage(),
                    new SourceLocation(FileUtils.toUnixPath(file), 0));
            } catch (IOException e) {
                collector.report(Severity.ERROR, "Failed to read symbol descriptor: " + e.getMessage(),
                    new SourceLocation(FileUtils.toUnixPath(file), 0));
            }
        }
        log.debug("Read {} symbol descriptor(s) from {}", groups.size(), sourceRoots);
        return groups;
    }

    private List<IncludedDocumentation> readIncludes() {
        List<IncludedDocumentation> docs = new ArrayList<>();
        for (Path include : includes) {
            if (!Files.isRegularFile(include)) {
                collector.report(Severity.WARNING, "Include file does not exist: " + include, null);
                continue;
            }
            read(include).ifPresent(content -> docs.addAll(IncludeFileParser.parse(content.lines().toList())));
        }
        return docs;
    }

    private Optional<String> read(Path file) {
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.debug("Failed to read {}", file, e);
            collector.report(Severity.ERROR, "Failed to read " + file + ": " + describe(e),
                new SourceLocation(FileUtils.toUnixPath(file), 0));
            return Optional.empty();
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
