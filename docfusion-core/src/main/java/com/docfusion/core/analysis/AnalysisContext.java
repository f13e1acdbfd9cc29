package com.docfusion.core.analysis;

import java.nio.file.Path;
import java.util.List;

/**
 * Opaque per-platform analysis handle built by an {@link AnalysisEnvironmentFactory}.
 *
 * <p>Accessors may perform I/O lazily (reading and parsing files) and are called from the
 * parallel translation stage; each context is only ever used by the task translating its
 * own platform.
 */
public interface AnalysisContext {

    /**
     * Returns the kind of front end that produced this context.
     *
     * @return front end kind
     */
    FrontEnd frontEnd();

    /**
     * Returns the absolute directory relative configuration paths of this pass resolve against.
     *
     * @return base directory
     */
    Path baseDirectory();

    /**
     * Returns the analyzed symbol groups, one per package and descriptor.
     *
     * @return symbol groups
     */
    List<SymbolGroup> symbolGroups();

    /**
     * Returns the analyzed source files.
     *
     * @return parsed source files
     */
    List<AnalyzedSourceFile> sourceFiles();

    /**
     * Returns the parsed sample files that {@code @sample} tags refer to.
     *
     * @return parsed sample files
     */
    List<AnalyzedSourceFile> sampleFiles();

    /**
     * Returns module and package documentation from include files.
     *
     * @return included documentation
     */
    List<IncludedDocumentation> includedDocumentation();

    /**
     * Returns the collector this context reports diagnostics to.
     *
     * @return message collector
     */
    MessageCollector messageCollector();
}
