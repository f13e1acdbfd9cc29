package com.docfusion.core.translator.impl;

import com.docfusion.core.analysis.AnalyzedSymbol;
import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.analysis.Severity;
import com.docfusion.core.analysis.SymbolGroup;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.model.SourceLocation;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.translator.SymbolTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps pre-analyzed symbol descriptors one to one onto documentables.
 *
 * <p>Symbols of kind {@code MODULE} or {@code PACKAGE} are not valid inside a group; they are
 * reported as errors and skipped along with their children. Callable signatures that are not
 * parenthesized are wrapped, so {@code "String,int"} and {@code "(String,int)"} identify the
 * same overload.
 */
public class DefaultSymbolTranslator implements SymbolTranslator {

    private static final Logger log = LoggerFactory.getLogger(DefaultSymbolTranslator.class);

    @Override
    public Module translate(PlatformContext platform, DocContext context) {
        ModuleAssembler assembler = new ModuleAssembler(platform);
        List<SymbolGroup> groups = platform.analysis().symbolGroups();

        for (SymbolGroup group : groups) {
            assembler.ensurePackage(group.packageName());
            DocumentableId packageId = DocumentableId.of(group.packageName());
            for (AnalyzedSymbol symbol : group.symbols()) {
                translate(symbol, packageId, group, platform).forEach(d -> assembler.add(group.packageName(), d));
            }
        }

        log.debug("Translated {} symbol group(s) for {}", groups.size(), platform.platformData());
        return assembler.build();
    }

    private List<Documentable> translate(AnalyzedSymbol symbol, DocumentableId parentId,
                                         SymbolGroup group, PlatformContext platform) {
        SourceLocation location = group.source() == null || group.source().isBlank()
            ? null : new SourceLocation(group.source(), Math.max(symbol.line(), 0));

        if (symbol.kind() == DocumentableKind.MODULE || symbol.kind() == DocumentableKind.PACKAGE) {
            platform.analysis().messageCollector().report(Severity.ERROR,
                "Symbol " + symbol.name() + " of kind " + symbol.kind() + " is not allowed inside package "
                    + group.packageName(), location);
            return List.of();
        }

        DocumentableId id = parentId.child(symbol.name(), signature(symbol));
        List<Documentable> children = new ArrayList<>();
        Set<DocumentableId> seen = new LinkedHashSet<>();
        for (AnalyzedSymbol child : symbol.children()) {
            for (Documentable translated : translate(child, id, group, platform)) {
                if (seen.add(translated.id())) {
                    children.add(translated);
                } else {
                    platform.analysis().messageCollector().report(Severity.WARNING,
                        "Duplicate declaration " + translated.id() + " ignored", location);
                }
            }
        }

        PlatformFacts facts = new PlatformFacts(
            symbol.documentation(),
            symbol.visibility(),
            location,
            symbol.annotations(),
            symbol.deprecated(),
            List.of(),
            symbol.supertypes());

        return List.of(new Documentable(id, symbol.name(), symbol.kind(),
            Map.of(platform.platformData(), facts), children, parentId));
    }

    private static String signature(AnalyzedSymbol symbol) {
        if (!symbol.kind().isCallable()) {
            return "";
        }
        String signature = symbol.signature().strip();
        return signature.startsWith("(") ? signature : "(" + signature + ")";
    }
}
