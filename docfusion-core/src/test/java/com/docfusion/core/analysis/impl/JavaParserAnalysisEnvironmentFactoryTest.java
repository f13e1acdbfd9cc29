package com.docfusion.core.analysis.impl;

import com.docfusion.core.SourceTreeTestBase;
import com.docfusion.core.analysis.AnalysisContext;
import com.docfusion.core.analysis.FrontEnd;
import com.docfusion.core.analysis.IncludedDocumentation;
import com.docfusion.core.analysis.SymbolGroup;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.exception.AnalysisEnvironmentException;
import com.docfusion.core.model.DocumentableKind;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JavaParserAnalysisEnvironmentFactoryTest extends SourceTreeTestBase {

    private static PassConfig pass(String platform, List<String> classpath, List<String> includes) {
        return new PassConfig("lib", platform, null, List.of("src"), classpath, null, includes, null, null, null,
            null, null, null, null, null, null, null);
    }

    private static PassConfig versionedPass(String languageVersion, String apiVersion, List<String> samples) {
        return new PassConfig("lib", "jvm", null, List.of("src"), null, samples, null, languageVersion, apiVersion,
            null, null, null, null, null, null, null, null);
    }

    private Path createLatin1File(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.ISO_8859_1));
        return file;
    }

    @Test
    void create_jvmPass_parsesJavaFilesAtAnyDepth() throws IOException {
        // Given
        createFile("src/Root.java", "public class Root {}");
        createFile("src/com/example/Cache.java", "package com.example; public class Cache {}");
        createFile("src/com/example/notes.txt", "ignored");

        // When
        AnalysisContext analysis = analyze(pass("jvm", null, null)).analysis();

        // Then
        assertThat(analysis.frontEnd()).isEqualTo(FrontEnd.JAVA_SOURCE);
        assertThat(analysis.sourceFiles())
            .extracting(file -> file.packageName())
            .containsExactlyInAnyOrder("", "com.example");
    }

    @Test
    void create_jsPass_readsSymbolDescriptorsInsteadOfJava() throws IOException {
        // Given
        createFile("src/cache.symbols.json", """
            {
              "package": "com.example",
              "source": "src/cache.ts",
              "symbols": [
                {"name": "Cache", "kind": "CLASS", "documentation": "JS cache.", "line": 3,
                 "children": [{"name": "get", "kind": "FUNCTION", "signature": "String"}]}
              ]
            }
            """);
        createFile("src/Ignored.java", "public class Ignored {}");

        // When
        AnalysisContext analysis = analyze(pass("js", null, null)).analysis();

        // Then
        assertThat(analysis.frontEnd()).isEqualTo(FrontEnd.SYMBOL_DESCRIPTORS);
        assertThat(analysis.sourceFiles()).isEmpty();
        assertThat(analysis.symbolGroups()).singleElement().satisfies(group -> {
            assertThat(group.packageName()).isEqualTo("com.example");
            assertThat(group.symbols().get(0).kind()).isEqualTo(DocumentableKind.CLASS);
            assertThat(group.symbols().get(0).children().get(0).signature()).isEqualTo("String");
        });
    }

    @Test
    void create_invalidDescriptor_reportsErrorAndContinues() throws IOException {
        createFile("src/broken.symbols.json", "{ not json");
        createFile("src/ok.symbols.json", "{\"package\": \"p\", \"symbols\": []}");

        List<SymbolGroup> groups = analyze(pass("js", null, null)).analysis().symbolGroups();

        assertThat(groups).extracting(SymbolGroup::packageName).containsExactly("p");
        assertThat(logger.infos()).anyMatch(message -> message.startsWith("error: ")
            && message.contains("Invalid symbol descriptor"));
    }

    @Test
    void create_unparsableJava_reportsErrorWithLocation() throws IOException {
        createFile("src/Broken.java", "public class Broken {");

        var context = analyze(pass("jvm", null, null));

        assertThat(context.analysis().sourceFiles()).isEmpty();
        assertThat(context.analysis().messageCollector().hasErrors()).isTrue();
        assertThat(logger.infos()).anyMatch(message -> message.contains("Broken.java"));
    }

    @Test
    void create_sourceFileNotInUtf8_reportsErrorAndParsesTheRest() throws IOException {
        // Given
        createLatin1File("src/p/A.java", "package p; /** Caf\u00e9 au lait. */ public class A {}");
        createFile("src/p/B.java", "package p; public class B {}");

        // When
        AnalysisContext analysis = analyze(pass("jvm", null, null)).analysis();

        // Then
        assertThat(analysis.sourceFiles())
            .extracting(file -> file.path().getFileName().toString())
            .containsExactly("B.java");
        assertThat(analysis.messageCollector().hasErrors()).isTrue();
        assertThat(logger.infos()).anyMatch(message -> message.startsWith("error: ")
            && message.contains("Failed to read") && message.contains("A.java"));
    }

    @Test
    void create_includeFileNotInUtf8_reportsErrorAndReadsTheRest() throws IOException {
        // Given
        createLatin1File("docs/broken.md", "# Module lib\nCaf\u00e9.\n");
        createFile("docs/ok.md", "# Package p\nThe package.\n");

        // When
        AnalysisContext analysis = analyze(pass("jvm", null, List.of("docs/broken.md", "docs/ok.md"))).analysis();

        // Then
        assertThat(analysis.includedDocumentation()).containsExactly(
            new IncludedDocumentation(IncludedDocumentation.Scope.PACKAGE, "p", "The package."));
        assertThat(analysis.messageCollector().hasErrors()).isTrue();
        assertThat(logger.infos()).anyMatch(message -> message.contains("broken.md"));
    }

    @Test
    void create_exposesNormalizedBaseDirectory() {
        AnalysisContext analysis = analyze(pass("jvm", null, null)).analysis();

        assertThat(analysis.baseDirectory()).isEqualTo(tempDir.toAbsolutePath().normalize());
    }

    @Test
    void create_parsesSampleFilesAndDirectories() throws IOException {
        // Given
        createFile("samples/p/CacheSamples.java", "package p; class CacheSamples { void put() {} }");
        createFile("extra/Single.java", "class Single {}");

        // When
        AnalysisContext analysis = analyze(versionedPass(null, null,
            List.of("samples", "extra/Single.java", "missing"))).analysis();

        // Then
        assertThat(analysis.sampleFiles())
            .extracting(file -> file.path().getFileName().toString())
            .containsExactly("CacheSamples.java", "Single.java");
        assertThat(analysis.sourceFiles()).isEmpty();
        assertThat(logger.infos()).anyMatch(message -> message.startsWith("warning: ")
            && message.contains("Sample path does not exist"));
    }

    @Test
    void create_apiVersionNewerThanLanguageVersion_throwsAnalysisEnvironmentException() {
        assertThatThrownBy(() -> analyze(versionedPass("11", "17", null)))
            .isInstanceOf(AnalysisEnvironmentException.class)
            .hasMessageContaining("API version 17 is newer than language version 11");
    }

    @Test
    void create_apiVersionUpToLanguageVersion_isAccepted() {
        assertThatCode(() -> analyze(versionedPass("17", "11", null))).doesNotThrowAnyException();
        assertThatCode(() -> analyze(versionedPass(null, "17", null))).doesNotThrowAnyException();
    }

    @Test
    void create_unsupportedApiVersion_throwsAnalysisEnvironmentException() {
        assertThatThrownBy(() -> analyze(versionedPass("17", "kotlin", null)))
            .isInstanceOf(AnalysisEnvironmentException.class)
            .hasMessage("Unsupported language version: kotlin");
    }

    @Test
    void create_missingClasspathEntry_throwsAnalysisEnvironmentException() {
        assertThatThrownBy(() -> analyze(pass("jvm", List.of("libs/missing.jar"), null)))
            .isInstanceOf(AnalysisEnvironmentException.class)
            .hasMessageContaining("missing.jar");
    }

    @Test
    void create_missingSourceRoot_onlyWarns() {
        var context = analyze(pass("jvm", null, null));

        assertThat(context.analysis().messageCollector().hasErrors()).isFalse();
        assertThat(logger.infos()).anyMatch(message -> message.startsWith("warning: ")
            && message.contains("Source root does not exist"));
    }

    @Test
    void create_readsModuleAndPackageIncludes() throws IOException {
        // Given
        createFile("docs/lib.md", """
            # Module lib
            The library.

            # Package com.example
            Example package.
            """);

        // When
        List<IncludedDocumentation> docs = analyze(pass("jvm", null, List.of("docs/lib.md")))
            .analysis().includedDocumentation();

        // Then
        assertThat(docs).containsExactly(
            new IncludedDocumentation(IncludedDocumentation.Scope.MODULE, "lib", "The library."),
            new IncludedDocumentation(IncludedDocumentation.Scope.PACKAGE, "com.example", "Example package."));
    }

    @ParameterizedTest
    @CsvSource({
        "17, JAVA_17",
        "1.8, JAVA_8",
        "8, JAVA_8",
        "java_11, JAVA_11"
    })
    void languageLevel_acceptsCommonSpellings(String version, LanguageLevel expected) {
        assertThat(JavaParserAnalysisEnvironmentFactory.languageLevel(version)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"kotlin", "1.x", "99"})
    void languageLevel_unknownVersion_throwsAnalysisEnvironmentException(String version) {
        assertThatThrownBy(() -> JavaParserAnalysisEnvironmentFactory.languageLevel(version))
            .isInstanceOf(AnalysisEnvironmentException.class)
            .hasMessage("Unsupported language version: " + version);
    }
}
