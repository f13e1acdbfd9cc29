package com.docfusion.core.transformer.impl;

import com.docfusion.core.Fixtures;
import com.docfusion.core.RecordingDocLogger;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.util.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.docfusion.core.Fixtures.JVM;
import static com.docfusion.core.Fixtures.factsAt;
import static com.docfusion.core.Fixtures.module;
import static com.docfusion.core.Fixtures.pkg;
import static com.docfusion.core.Fixtures.type;
import static org.assertj.core.api.Assertions.*;

class SuppressedDocumentableFilterTest {

    @TempDir
    Path tempDir;

    private final SuppressedDocumentableFilter filter = new SuppressedDocumentableFilter();

    private DocContext contextWith(List<String> suppressedFiles, List<PassConfig.PackageOptions> options) {
        PassConfig pass = Fixtures.pass(JVM, null, null, null, null, suppressedFiles, options);
        return Fixtures.context(Fixtures.config(pass), new RecordingDocLogger());
    }

    private Documentable classIn(String qualifiedName, Path file) {
        return type(qualifiedName, DocumentableKind.CLASS, JVM, factsAt("doc", FileUtils.toUnixPath(file), 3));
    }

    @Test
    void transform_dropsSuppressedPackageWithSubpackages() {
        // Given
        DocContext context = contextWith(null, List.of(new PassConfig.PackageOptions("p.impl", null, null, null, true)));
        Module module = module("lib", JVM,
            pkg("p", JVM, Fixtures.cls("p.Api", JVM, "doc")),
            pkg("p.impl", JVM, Fixtures.cls("p.impl.Impl", JVM, "doc")),
            pkg("p.impl.deep", JVM));

        // When
        Module result = filter.transform(module, context);

        // Then
        assertThat(result.packages()).extracting(Documentable::name).containsExactly("p");
    }

    @Test
    void transform_dropsDeclarationsFromSuppressedDirectory() {
        // Given
        Path generated = tempDir.resolve("src/gen");
        DocContext context = contextWith(List.of(generated.toString()), null);
        Module module = module("lib", JVM, pkg("p", JVM,
            classIn("p.Kept", tempDir.resolve("src/main/Kept.java")),
            classIn("p.Generated", generated.resolve("Generated.java"))));

        // When
        Module result = filter.transform(module, context);

        // Then
        assertThat(result.findPackage("p").orElseThrow().children())
            .extracting(Documentable::name).containsExactly("Kept");
    }

    @Test
    void transform_dropsDeclarationsFromSuppressedFile() {
        Path file = tempDir.resolve("src/Legacy.java");
        DocContext context = contextWith(List.of(file.toString()), null);
        Module module = module("lib", JVM, pkg("p", JVM, classIn("p.Legacy", file)));

        Module result = filter.transform(module, context);

        assertThat(result.findPackage("p").orElseThrow().children()).isEmpty();
    }

    @Test
    void transform_relativeSuppressedFile_resolvesAgainstAnalysisBaseDirectory() {
        // Given
        Path project = tempDir.resolve("project");
        PassConfig pass = Fixtures.pass(JVM, null, null, null, null, List.of("src/p/Legacy.java"), null);
        DocContext context = Fixtures.context(Fixtures.config(pass), new RecordingDocLogger(), project);
        Module module = module("lib", JVM, pkg("p", JVM,
            classIn("p.Legacy", project.resolve("src/p/Legacy.java")),
            classIn("p.Current", project.resolve("src/p/Current.java"))));

        // When
        Module result = filter.transform(module, context);

        // Then
        assertThat(result.findPackage("p").orElseThrow().children())
            .extracting(Documentable::name).containsExactly("Current");
    }

    @Test
    void transform_siblingWithSharedPrefixIsNotSuppressed() {
        Path generated = tempDir.resolve("src/gen");
        DocContext context = contextWith(List.of(generated.toString()), null);
        Module module = module("lib", JVM, pkg("p", JVM,
            classIn("p.Other", tempDir.resolve("src/generator/Other.java"))));

        Module result = filter.transform(module, context);

        assertThat(result.findPackage("p").orElseThrow().children()).hasSize(1);
    }
}
