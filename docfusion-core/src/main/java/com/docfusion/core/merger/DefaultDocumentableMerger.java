package com.docfusion.core.merger;

import com.docfusion.core.exception.ConfigurationException;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.plugin.DocContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-platform modules by walking their trees in lock-step, keyed by
 * {@link DocumentableId}.
 *
 * <p><b>Algorithm:</b>
 * <ul>
 *   <li>At every level, children of all inputs are grouped by id, in order of first
 *       occurrence across the input list.</li>
 *   <li>A child that occurs in one input only is adopted unchanged, except that it and every
 *       descendant carrying no facts is tagged with its input's platforms so every merged node
 *       stays attributable.</li>
 *   <li>A child that occurs in several inputs is merged recursively: its fact maps are
 *       unioned, the first input wins per platform key, and its name and kind come from the
 *       first occurrence.</li>
 * </ul>
 *
 * <p>Facts of different platforms are never reconciled: two platforms documenting the same
 * declaration differently both keep their own text.
 */
public class DefaultDocumentableMerger implements DocumentableMerger {

    private static final Logger log = LoggerFactory.getLogger(DefaultDocumentableMerger.class);

    @Override
    public Module merge(List<Module> modules, DocContext context) {
        if (modules == null || modules.isEmpty()) {
            throw new ConfigurationException("Nothing to merge: no documentation module was produced");
        }
        if (modules.size() == 1) {
            return modules.get(0);
        }

        String name = modules.stream()
            .map(Module::name)
            .filter(n -> !n.isBlank())
            .findFirst()
            .orElse("");

        Map<PlatformData, PlatformFacts> facts = new LinkedHashMap<>();
        List<Sourced> packages = new ArrayList<>();
        for (Module module : modules) {
            module.facts().forEach(facts::putIfAbsent);
            for (Documentable pkg : module.packages()) {
                packages.add(new Sourced(pkg, module.platforms()));
            }
        }

        Module merged = new Module(name, facts, mergeLevel(packages));
        log.debug("Merged {} modules into '{}' with {} packages", modules.size(), name, merged.packages().size());
        return merged;
    }

    private List<Documentable> mergeLevel(List<Sourced> candidates) {
        Map<DocumentableId, List<Sourced>> byId = new LinkedHashMap<>();
        for (Sourced candidate : candidates) {
            byId.computeIfAbsent(candidate.documentable().id(), id -> new ArrayList<>()).add(candidate);
        }

        List<Documentable> merged = new ArrayList<>(byId.size());
        for (List<Sourced> occurrences : byId.values()) {
            merged.add(occurrences.size() == 1 ? adopt(occurrences.get(0)) : mergeOccurrences(occurrences));
        }
        return merged;
    }

    private Documentable adopt(Sourced single) {
        return tagSubtree(single.documentable(), single.platforms());
    }

    private static Documentable tagSubtree(Documentable documentable, Set<PlatformData> platforms) {
        List<Documentable> children = new ArrayList<>(documentable.children().size());
        boolean changed = false;
        for (Documentable child : documentable.children()) {
            Documentable tagged = tagSubtree(child, platforms);
            changed |= tagged != child;
            children.add(tagged);
        }
        if (!documentable.facts().isEmpty() && !changed) {
            return documentable;
        }
        Map<PlatformData, PlatformFacts> facts = documentable.facts().isEmpty()
            ? tagged(platforms) : documentable.facts();
        return new Documentable(documentable.id(), documentable.name(), documentable.kind(), facts, children,
            documentable.parent());
    }

    private Documentable mergeOccurrences(List<Sourced> occurrences) {
        Documentable first = occurrences.get(0).documentable();

        Map<PlatformData, PlatformFacts> facts = new LinkedHashMap<>();
        List<Sourced> children = new ArrayList<>();
        for (Sourced occurrence : occurrences) {
            Documentable documentable = occurrence.documentable();
            Map<PlatformData, PlatformFacts> ownFacts = documentable.facts().isEmpty()
                ? tagged(occurrence.platforms())
                : documentable.facts();
            ownFacts.forEach(facts::putIfAbsent);
            for (Documentable child : documentable.children()) {
                children.add(new Sourced(child, occurrence.platforms()));
            }
        }

        return new Documentable(first.id(), first.name(), first.kind(), facts, mergeLevel(children), first.parent());
    }

    private static Map<PlatformData, PlatformFacts> tagged(Set<PlatformData> platforms) {
        Map<PlatformData, PlatformFacts> facts = new LinkedHashMap<>();
        platforms.forEach(platform -> facts.put(platform, PlatformFacts.empty()));
        return facts;
    }

    private record Sourced(Documentable documentable, Set<PlatformData> platforms) {}
}
