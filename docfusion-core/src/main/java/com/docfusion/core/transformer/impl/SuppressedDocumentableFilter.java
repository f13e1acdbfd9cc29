package com.docfusion.core.transformer.impl;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.util.FileUtils;

import java.nio.file.Path;

/**
 * Drops suppressed packages and declarations from suppressed files.
 *
 * <p>A package is suppressed by a matching {@code perPackageOptions} entry with
 * {@code suppress: true}. A {@code suppressedFiles} entry suppresses the file itself, or every
 * file below it when it names a directory; relative entries resolve against the analysis base
 * directory of the pass.
 */
public class SuppressedDocumentableFilter extends PlatformFactsFilter {

    @Override
    protected boolean keep(Documentable documentable, String packageName, PlatformFacts facts, PassConfig pass,
                           Path baseDirectory) {
        if (pass.suppressedPackage(packageName)) {
            return false;
        }
        if (facts.location() == null || pass.suppressedFiles().isEmpty()) {
            return true;
        }
        String location = facts.location().path();
        return pass.suppressedFiles().stream()
            .map(suppressed -> FileUtils.toAbsoluteUnixPath(baseDirectory, suppressed))
            .noneMatch(suppressed -> location.equals(suppressed) || location.startsWith(suppressed + "/"));
    }
}
