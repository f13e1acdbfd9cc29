package com.docfusion.core.transformer.impl;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.PlatformFacts;

import java.nio.file.Path;

/**
 * Drops deprecated declarations where {@code skipDeprecated} applies to their package.
 */
public class DeprecatedDocumentableFilter extends PlatformFactsFilter {

    @Override
    protected boolean keep(Documentable documentable, String packageName, PlatformFacts facts, PassConfig pass,
                           Path baseDirectory) {
        return !facts.deprecated() || !pass.skipDeprecatedFor(packageName);
    }
}
