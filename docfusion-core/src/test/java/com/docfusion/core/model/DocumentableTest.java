package com.docfusion.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DocumentableTest {

    private static final PlatformData JVM = PlatformData.of("lib", AnalysisPlatform.JVM);

    private static Documentable leaf(DocumentableId id, DocumentableKind kind) {
        return new Documentable(id, id.path(), kind, Map.of(JVM, PlatformFacts.empty()), List.of(), null);
    }

    @Test
    void constructor_duplicateChildIds_throwsException() {
        DocumentableId id = new DocumentableId("p.Cache.get", "(String)");

        assertThatThrownBy(() -> new Documentable(DocumentableId.of("p.Cache"), "Cache", DocumentableKind.CLASS,
                Map.of(), List.of(leaf(id, DocumentableKind.FUNCTION), leaf(id, DocumentableKind.FUNCTION)), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate child id p.Cache.get(String)");
    }

    @Test
    void constructor_overloadsWithDifferentSignatures_areDistinct() {
        Documentable cache = new Documentable(DocumentableId.of("p.Cache"), "Cache", DocumentableKind.CLASS,
            Map.of(), List.of(
                leaf(new DocumentableId("p.Cache.get", "(String)"), DocumentableKind.FUNCTION),
                leaf(new DocumentableId("p.Cache.get", "(int)"), DocumentableKind.FUNCTION)), null);

        assertThat(cache.children()).hasSize(2);
        assertThat(cache.child(new DocumentableId("p.Cache.get", "(int)"))).isPresent();
    }

    @Test
    void module_acceptsOnlyPackages() {
        Documentable type = leaf(DocumentableId.of("p.Cache"), DocumentableKind.CLASS);

        assertThatThrownBy(() -> new Module("lib", Map.of(), List.of(type)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("may only own packages");
    }

    @Test
    void mapFacts_keepsPlatformKeys() {
        Documentable documentable = leaf(DocumentableId.of("p.Cache"), DocumentableKind.CLASS);

        Documentable marked = documentable.mapFacts(facts -> facts.withMarker("undocumented"));

        assertThat(marked.platforms()).containsExactly(JVM);
        assertThat(marked.factsFor(JVM)).hasValueSatisfying(facts ->
            assertThat(facts.markers()).containsExactly("undocumented"));
        assertThat(documentable.factsFor(JVM).orElseThrow().markers()).isEmpty();
    }

    @Test
    void ids_renderPathAndSignature() {
        DocumentableId owner = DocumentableId.of("");

        assertThat(owner.child("Cache", "")).hasToString("Cache");
        assertThat(DocumentableId.of("p").child("put", DocumentableId.signatureOf(List.of("String", "int"))))
            .hasToString("p.put(String,int)");
    }

    @Test
    void platformData_rendersNameKeyAndTargets() {
        assertThat(JVM).hasToString("lib[jvm]");
        assertThat(new PlatformData("lib", AnalysisPlatform.NATIVE, List.of("linuxX64", "macosArm64")))
            .hasToString("lib[native:linuxX64,macosArm64]");
    }

    @Test
    void analysisPlatform_parsesKeysCaseInsensitively() {
        assertThat(AnalysisPlatform.fromString(" JS ")).isEqualTo(AnalysisPlatform.JS);
        assertThat(AnalysisPlatform.fromString(null)).isEqualTo(AnalysisPlatform.JVM);
        assertThatThrownBy(() -> AnalysisPlatform.fromString("wasm"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown analysis platform: wasm");
    }
}
