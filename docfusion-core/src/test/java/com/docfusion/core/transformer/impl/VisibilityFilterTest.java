package com.docfusion.core.transformer.impl;

import com.docfusion.core.Fixtures;
import com.docfusion.core.RecordingDocLogger;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.Visibility;
import com.docfusion.core.plugin.DocContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.docfusion.core.Fixtures.JS;
import static com.docfusion.core.Fixtures.JVM;
import static com.docfusion.core.Fixtures.facts;
import static com.docfusion.core.Fixtures.module;
import static com.docfusion.core.Fixtures.pkg;
import static com.docfusion.core.Fixtures.type;
import static org.assertj.core.api.Assertions.*;

class VisibilityFilterTest {

    private final VisibilityFilter filter = new VisibilityFilter();

    private static Documentable internalClass(String name) {
        return type(name, DocumentableKind.CLASS, JVM, facts("doc", Visibility.INTERNAL, false));
    }

    @Test
    void transform_dropsNonPublicDeclarationsByDefault() {
        // Given
        Documentable open = Fixtures.cls("p.Open", JVM, "doc");
        Module module = module("lib", JVM, pkg("p", JVM, open, internalClass("p.Hidden")));

        // When
        Module result = filter.transform(module, Fixtures.context(JVM));

        // Then
        assertThat(result.findPackage("p").orElseThrow().children()).containsExactly(open);
    }

    @Test
    void transform_withIncludeNonPublicForPackage_keepsThatPackageOnly() {
        // Given
        PassConfig pass = Fixtures.pass(JVM, null, null, null, null, null,
            List.of(new PassConfig.PackageOptions("p.internal", true, null, null, null)));
        DocContext context = Fixtures.context(Fixtures.config(pass), new RecordingDocLogger());
        Module module = module("lib", JVM,
            pkg("p", JVM, internalClass("p.Hidden")),
            pkg("p.internal", JVM, internalClass("p.internal.Shown")));

        // When
        Module result = filter.transform(module, context);

        // Then
        assertThat(result.findPackage("p").orElseThrow().children()).isEmpty();
        assertThat(result.findPackage("p.internal").orElseThrow().children())
            .extracting(Documentable::name).containsExactly("Shown");
    }

    @Test
    void transform_dropsOnlyThePlatformWhereDeclarationIsPrivate() {
        // Given
        Documentable mixed = new Documentable(
            DocumentableId.of("p.C"), "C", DocumentableKind.CLASS,
            Map.of(JVM, facts("doc", Visibility.PUBLIC, false), JS, facts("doc", Visibility.PRIVATE, false)),
            List.of(), DocumentableId.of("p"));
        Documentable p = new Documentable(DocumentableId.of("p"), "p",
            DocumentableKind.PACKAGE, Map.of(), List.of(mixed), null);
        Module module = new Module("lib", Map.of(), List.of(p));

        // When
        Module result = filter.transform(module, Fixtures.context(JVM, JS));

        // Then
        assertThat(result.findPackage("p").orElseThrow().children().get(0).platforms()).containsExactly(JVM);
    }

    @Test
    void transform_membersOfDroppedClassAreDroppedToo() {
        Documentable member = Fixtures.function("p.Hidden", "run", "()", JVM, facts("doc", Visibility.PUBLIC, false));
        Documentable hidden = type("p.Hidden", DocumentableKind.CLASS, JVM,
            facts("doc", Visibility.PRIVATE, false), member);
        Module module = module("lib", JVM, pkg("p", JVM, hidden));

        Module result = filter.transform(module, Fixtures.context(JVM));

        assertThat(result.findPackage("p").orElseThrow().children()).isEmpty();
    }

    @Test
    void transform_withNothingToDrop_keepsSameInstances() {
        Documentable open = Fixtures.cls("p.Open", JVM, "doc");
        Documentable p = pkg("p", JVM, open);
        Module module = module("lib", JVM, p);

        Module result = filter.transform(module, Fixtures.context(JVM));

        assertThat(result.packages().get(0)).isSameAs(p);
    }
}
