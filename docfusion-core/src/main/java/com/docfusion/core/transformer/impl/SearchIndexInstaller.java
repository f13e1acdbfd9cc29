package com.docfusion.core.transformer.impl;

import com.docfusion.core.model.PlatformData;
import com.docfusion.core.pages.ContentPage;
import com.docfusion.core.pages.PageLocations;
import com.docfusion.core.pages.RendererSpecificPage;
import com.docfusion.core.pages.RootPageNode;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.PageTransformer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends {@code search-index.json}: one entry per content page with its qualified name,
 * output path and platforms.
 */
public class SearchIndexInstaller implements PageTransformer {

    static final String PATH = "search-index.json";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Override
    public RootPageNode transform(RootPageNode root, DocContext context) {
        List<SearchEntry> entries = new ArrayList<>();
        PageLocations.walk(root, (page, path) -> {
            if (page instanceof ContentPage content) {
                entries.add(new SearchEntry(
                    content.documentable().toString(),
                    path,
                    content.platforms().stream().map(PlatformData::toString).toList()));
            }
        });

        try {
            String json = JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(entries);
            return root.withChild(new RendererSpecificPage("search-index", PATH, json, List.of()));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize search index", e);
        }
    }

    /**
     * One search index entry.
     *
     * @param name qualified declaration name
     * @param path page path relative to the output root
     * @param platforms platforms the declaration is available on
     */
    public record SearchEntry(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("platforms") List<String> platforms
    ) {}
}
