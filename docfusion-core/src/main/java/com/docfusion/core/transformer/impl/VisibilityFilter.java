package com.docfusion.core.transformer.impl;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.PlatformFacts;

import java.nio.file.Path;

/**
 * Keeps public and protected declarations, and everything else only where
 * {@code includeNonPublic} applies to the declaration's package.
 */
public class VisibilityFilter extends PlatformFactsFilter {

    @Override
    protected boolean keep(Documentable documentable, String packageName, PlatformFacts facts, PassConfig pass,
                           Path baseDirectory) {
        return facts.visibility().isPublicApi() || pass.includeNonPublicFor(packageName);
    }
}
