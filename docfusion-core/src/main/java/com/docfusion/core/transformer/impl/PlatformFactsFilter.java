package com.docfusion.core.transformer.impl;

import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.DocumentableTransformer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Base class for transformers that drop declarations per platform.
 *
 * <p>For every declaration and platform, {@link #keep} decides whether the platform's facts
 * stay. A declaration left without facts is removed with its subtree. Children never keep a
 * platform their parent lost. Declarations that carried no facts to begin with are kept.
 * Platforms without a pass configuration in the run are never filtered.
 */
public abstract class PlatformFactsFilter implements DocumentableTransformer {

    @Override
    public Module transform(Module module, DocContext context) {
        List<Documentable> packages = new ArrayList<>();
        for (Documentable pkg : module.packages()) {
            filter(pkg, pkg.id().path(), null, context).ifPresent(packages::add);
        }
        return module.withPackages(packages);
    }

    /**
     * Decides whether a platform's facts of a declaration stay.
     *
     * @param documentable declaration under test
     * @param packageName package the declaration belongs to
     * @param facts facts of the platform
     * @param pass pass configuration of the platform
     * @param baseDirectory directory the pass's relative paths resolve against
     * @return true to keep the facts
     */
    protected abstract boolean keep(Documentable documentable, String packageName, PlatformFacts facts,
                                    PassConfig pass, Path baseDirectory);

    private Optional<Documentable> filter(Documentable documentable, String packageName,
                                          Set<PlatformData> parentPlatforms, DocContext context) {
        Map<PlatformData, PlatformFacts> kept = new LinkedHashMap<>();
        documentable.facts().forEach((platform, facts) -> {
            if (parentPlatforms != null && !parentPlatforms.contains(platform)) {
                return;
            }
            Optional<PassConfig> pass = context.passFor(platform);
            if (pass.isEmpty()
                    || keep(documentable, packageName, facts, pass.get(), context.baseDirectoryFor(platform))) {
                kept.put(platform, facts);
            }
        });

        if (kept.isEmpty() && !documentable.facts().isEmpty()) {
            return Optional.empty();
        }

        Set<PlatformData> visible = kept.isEmpty() ? parentPlatforms : kept.keySet();
        List<Documentable> children = new ArrayList<>();
        for (Documentable child : documentable.children()) {
            filter(child, packageName, visible, context).ifPresent(children::add);
        }

        if (kept.size() == documentable.facts().size() && children.size() == documentable.children().size()) {
            return Optional.of(documentable);
        }
        return Optional.of(new Documentable(documentable.id(), documentable.name(), documentable.kind(),
            kept, children, documentable.parent()));
    }
}
