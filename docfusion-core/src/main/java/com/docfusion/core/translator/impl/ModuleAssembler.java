package com.docfusion.core.translator.impl;

import com.docfusion.core.analysis.IncludedDocumentation;
import com.docfusion.core.analysis.MessageCollector;
import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.analysis.Severity;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the top-level declarations of one platform per package and builds the module.
 *
 * <p>Declarations of the same package from different files fold into one package node. A
 * second declaration with an id already present in its package is reported as a warning and
 * dropped.
 */
class ModuleAssembler {

    static final String ROOT_PACKAGE_NAME = "<root>";

    private final PlatformContext platform;
    private final Map<String, Map<DocumentableId, Documentable>> packages = new LinkedHashMap<>();
    private final Map<String, String> packageDocumentation = new LinkedHashMap<>();

    ModuleAssembler(PlatformContext platform) {
        this.platform = platform;
    }

    void ensurePackage(String packageName) {
        packages.computeIfAbsent(packageName, name -> new LinkedHashMap<>());
    }

    void add(String packageName, Documentable declaration) {
        Map<DocumentableId, Documentable> members = packages.computeIfAbsent(packageName, name -> new LinkedHashMap<>());
        if (members.putIfAbsent(declaration.id(), declaration) != null) {
            SourceLocation location = declaration.factsFor(platform.platformData())
                .map(PlatformFacts::location)
                .orElse(null);
            collector().report(Severity.WARNING, "Duplicate declaration " + declaration.id() + " ignored", location);
        }
    }

    void documentPackage(String packageName, String documentation) {
        if (documentation != null && !documentation.isBlank()) {
            packageDocumentation.merge(packageName, documentation, (existing, added) -> existing + "\n\n" + added);
        }
    }

    Module build() {
        PlatformData platformData = platform.platformData();
        String moduleName = platform.pass().moduleName();

        for (IncludedDocumentation included : platform.analysis().includedDocumentation()) {
            if (included.scope() == IncludedDocumentation.Scope.PACKAGE && packages.containsKey(included.name())) {
                documentPackage(included.name(), included.text());
            }
        }

        List<Documentable> packageNodes = new ArrayList<>();
        packages.forEach((packageName, members) -> {
            PlatformFacts facts = PlatformFacts.documented(packageDocumentation.get(packageName));
            packageNodes.add(new Documentable(
                DocumentableId.of(packageName),
                packageName.isEmpty() ? ROOT_PACKAGE_NAME : packageName,
                DocumentableKind.PACKAGE,
                Map.of(platformData, facts),
                List.copyOf(members.values()),
                null));
        });

        String moduleDocumentation = platform.analysis().includedDocumentation().stream()
            .filter(included -> included.scope() == IncludedDocumentation.Scope.MODULE)
            .filter(included -> included.name().equals(moduleName))
            .map(IncludedDocumentation::text)
            .reduce((first, second) -> first + "\n\n" + second)
            .orElse(null);

        return new Module(moduleName, Map.of(platformData, PlatformFacts.documented(moduleDocumentation)), packageNodes);
    }

    private MessageCollector collector() {
        return platform.analysis().messageCollector();
    }
}
