package com.docfusion.core.translator.impl;

import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.model.SourceLocation;
import com.docfusion.core.pages.ContentBlock;
import com.docfusion.core.pages.ContentKind;
import com.docfusion.core.pages.ContentPage;
import com.docfusion.core.pages.PageNode;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.translator.PageTranslator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Default page layout: one page per package and one per classifier, with members rendered as
 * blocks on their owner's page.
 *
 * <p>A declaration documented differently on several platforms gets one documentation block per
 * distinct text, tagged with the platforms sharing it, in fact order. Output depends only on
 * the module, so equal modules give equal page trees.
 */
public class DefaultPageTranslator implements PageTranslator {

    static final String SUPERTYPES = "Supertypes";
    static final String TYPES = "Types";
    static final String CONSTRUCTORS = "Constructors";
    static final String FUNCTIONS = "Functions";
    static final String PROPERTIES = "Properties";
    static final String ENTRIES = "Entries";
    static final String TYPE_ALIASES = "Type aliases";

    @Override
    public RootPageNode translate(Module module, DocContext context) {
        List<PlatformData> platforms = List.copyOf(module.platforms());

        List<ContentBlock> content = new ArrayList<>();
        content.add(ContentBlock.of(ContentKind.HEADER, module.name()));
        content.addAll(documentationBlocks(module.facts()));
        List<ContentBlock> packageLinks = module.packages().stream()
            .map(pkg -> ContentBlock.forPlatforms(ContentKind.LINK, pkg.name(), List.copyOf(pkg.platforms())))
            .toList();
        if (!packageLinks.isEmpty()) {
            content.add(ContentBlock.section("Packages", packageLinks));
        }

        List<PageNode> children = new ArrayList<>();
        for (Documentable pkg : module.packages()) {
            children.add(page(pkg, "Package " + pkg.name()));
        }
        return new RootPageNode(module.name(), platforms, content, children);
    }

    private ContentPage page(Documentable documentable, String title) {
        List<PlatformData> platforms = List.copyOf(documentable.platforms());

        List<ContentBlock> content = new ArrayList<>();
        content.add(ContentBlock.of(ContentKind.HEADER, title));
        if (!platforms.isEmpty()) {
            content.add(ContentBlock.forPlatforms(ContentKind.PLATFORMS, platformNames(platforms), platforms));
        }
        deprecationBlock(documentable).ifPresent(content::add);
        content.addAll(documentationBlocks(documentable.facts()));
        supertypesSection(documentable).ifPresent(content::add);

        List<Documentable> classifiers = documentable.children().stream()
            .filter(child -> child.kind().isClassifier())
            .toList();
        if (!classifiers.isEmpty()) {
            content.add(ContentBlock.section(TYPES, classifiers.stream()
                .map(type -> ContentBlock.forPlatforms(ContentKind.LINK, type.name(), List.copyOf(type.platforms())))
                .toList()));
        }
        addMemberSection(content, CONSTRUCTORS, documentable, DocumentableKind.CONSTRUCTOR);
        addMemberSection(content, ENTRIES, documentable, DocumentableKind.ENUM_ENTRY);
        addMemberSection(content, PROPERTIES, documentable, DocumentableKind.PROPERTY);
        addMemberSection(content, FUNCTIONS, documentable, DocumentableKind.FUNCTION);
        addMemberSection(content, TYPE_ALIASES, documentable, DocumentableKind.TYPE_ALIAS);

        List<PageNode> children = new ArrayList<>();
        for (Documentable type : classifiers) {
            children.add(page(type, type.name()));
        }
        return new ContentPage(documentable.name(), documentable.id(), documentable.kind(), platforms,
            sources(documentable), content, children);
    }

    private void addMemberSection(List<ContentBlock> content, String title, Documentable owner, DocumentableKind kind) {
        List<ContentBlock> members = owner.children().stream()
            .filter(child -> child.kind() == kind)
            .map(this::memberBlock)
            .toList();
        if (!members.isEmpty()) {
            content.add(ContentBlock.section(title, members));
        }
    }

    private ContentBlock memberBlock(Documentable member) {
        List<ContentBlock> details = new ArrayList<>();
        deprecationBlock(member).ifPresent(details::add);
        details.addAll(documentationBlocks(member.facts()));
        return new ContentBlock(ContentKind.SIGNATURE, member.name() + member.id().signature(),
            List.copyOf(member.platforms()), details);
    }

    private static Optional<ContentBlock> deprecationBlock(Documentable documentable) {
        List<PlatformData> deprecatedOn = documentable.facts().entrySet().stream()
            .filter(entry -> entry.getValue().deprecated())
            .map(Map.Entry::getKey)
            .toList();
        if (deprecatedOn.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ContentBlock.forPlatforms(ContentKind.DEPRECATION, "Deprecated", deprecatedOn));
    }

    private static Optional<ContentBlock> supertypesSection(Documentable documentable) {
        Map<String, List<PlatformData>> byName = new LinkedHashMap<>();
        documentable.facts().forEach((platform, facts) -> facts.supertypes()
            .forEach(name -> byName.computeIfAbsent(name, key -> new ArrayList<>()).add(platform)));
        if (byName.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ContentBlock.section(SUPERTYPES, byName.entrySet().stream()
            .map(entry -> ContentBlock.forPlatforms(ContentKind.TYPE_REFERENCE, entry.getKey(), entry.getValue()))
            .toList()));
    }

    private static List<ContentBlock> documentationBlocks(Map<PlatformData, PlatformFacts> facts) {
        Map<String, List<PlatformData>> byText = new LinkedHashMap<>();
        facts.forEach((platform, value) -> {
            if (value.hasDocumentation()) {
                byText.computeIfAbsent(value.documentation().strip(), text -> new ArrayList<>()).add(platform);
            }
        });
        return byText.entrySet().stream()
            .map(entry -> ContentBlock.forPlatforms(ContentKind.TEXT, entry.getKey(), entry.getValue()))
            .toList();
    }

    private static Map<PlatformData, SourceLocation> sources(Documentable documentable) {
        Map<PlatformData, SourceLocation> sources = new LinkedHashMap<>();
        documentable.facts().forEach((platform, facts) -> {
            if (facts.location() != null) {
                sources.put(platform, facts.location());
            }
        });
        return sources;
    }

    private static String platformNames(List<PlatformData> platforms) {
        return platforms.stream().map(PlatformData::toString).collect(Collectors.joining(", "));
    }
}
