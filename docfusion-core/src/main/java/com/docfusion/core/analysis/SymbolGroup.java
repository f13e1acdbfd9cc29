package com.docfusion.core.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Symbols of one package as delivered by a symbol-level front end.
 *
 * <p><b>Descriptor file format ({@code *.symbols.json}):</b>
 * <pre>{@code
 * {
 *   "package": "com.example.cache",
 *   "source": "src/jsMain/kotlin/Cache.kt",
 *   "symbols": [
 *     { "name": "Cache", "kind": "CLASS", "documentation": "LRU cache.",
 *       "children": [ { "name": "get", "kind": "FUNCTION", "signature": "String" } ] }
 *   ]
 * }
 * }</pre>
 *
 * @param packageName dotted package name; empty for the root package
 * @param source source file the symbols were declared in, or {@code null}
 * @param symbols top-level declarations of the package
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SymbolGroup(
    @JsonProperty("package") String packageName,
    @JsonProperty("source") String source,
    @JsonProperty("symbols") List<AnalyzedSymbol> symbols
) {
    /**
     * Compact constructor applying defaults.
     */
    public SymbolGroup {
        if (packageName == null) {
            packageName = "";
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}
