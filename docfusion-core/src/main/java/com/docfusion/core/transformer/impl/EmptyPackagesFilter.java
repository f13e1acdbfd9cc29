package com.docfusion.core.transformer.impl;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.DocumentableTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Drops packages without declarations when every platform that contributed the package has
 * {@code skipEmptyPackages} set.
 *
 * <p>Runs after the other filters so packages they emptied are dropped too.
 */
public class EmptyPackagesFilter implements DocumentableTransformer {

    private static final Logger log = LoggerFactory.getLogger(EmptyPackagesFilter.class);

    @Override
    public Module transform(Module module, DocContext context) {
        return module.withPackages(module.packages().stream()
            .filter(pkg -> !pkg.children().isEmpty() || !skip(pkg, module, context))
            .toList());
    }

    private boolean skip(Documentable pkg, Module module, DocContext context) {
        Set<PlatformData> platforms = pkg.facts().isEmpty() ? module.platforms() : pkg.platforms();
        boolean skip = !platforms.isEmpty() && platforms.stream()
            .allMatch(platform -> context.passFor(platform).map(PassConfig::skipEmptyPackages).orElse(false));
        if (skip) {
            log.debug("Skipping empty package {}", pkg.id());
        }
        return skip;
    }
}
