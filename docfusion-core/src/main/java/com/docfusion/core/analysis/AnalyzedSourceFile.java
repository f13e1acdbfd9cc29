package com.docfusion.core.analysis;

import com.github.javaparser.ast.CompilationUnit;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Source file parsed by a file-level front end.
 *
 * @param path file path
 * @param unit parsed compilation unit
 */
public record AnalyzedSourceFile(
    Path path,
    CompilationUnit unit
) {
    /**
     * Compact constructor with validation.
     */
    public AnalyzedSourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
    }

    /**
     * Returns the declared package of the file.
     *
     * @return dotted package name; empty for the root package
     */
    public String packageName() {
        return unit.getPackageDeclaration()
            .map(declaration -> declaration.getNameAsString())
            .orElse("");
    }
}
