package com.docfusion.core.analysis;

import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Visibility;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Declaration produced by a symbol-level front end.
 *
 * <p>Deserialized from symbol descriptor files; see {@link SymbolGroup}.
 *
 * @param name simple name
 * @param kind declaration kind
 * @param signature overload discriminator for callables, empty otherwise
 * @param documentation documentation text, or {@code null}
 * @param visibility declared visibility (default public)
 * @param annotations annotation names
 * @param deprecated whether the declaration is deprecated
 * @param line 1-based declaration line, or 0
 * @param children nested declarations
 * @param supertypes qualified names of extended and implemented types
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzedSymbol(
    @JsonProperty("name") String name,
    @JsonProperty("kind") DocumentableKind kind,
    @JsonProperty("signature") String signature,
    @JsonProperty("documentation") String documentation,
    @JsonProperty("visibility") Visibility visibility,
    @JsonProperty("annotations") List<String> annotations,
    @JsonProperty("deprecated") boolean deprecated,
    @JsonProperty("line") int line,
    @JsonProperty("children") List<AnalyzedSymbol> children,
    @JsonProperty("supertypes") List<String> supertypes
) {
    /**
     * Compact constructor with validation.
     */
    public AnalyzedSymbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (signature == null) {
            signature = "";
        }
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        children = children == null ? List.of() : List.copyOf(children);
        supertypes = supertypes == null ? List.of() : List.copyOf(supertypes);
    }
}
