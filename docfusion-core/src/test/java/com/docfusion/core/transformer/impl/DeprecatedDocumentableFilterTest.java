package com.docfusion.core.transformer.impl;

import com.docfusion.core.Fixtures;
import com.docfusion.core.RecordingDocLogger;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.Visibility;
import org.junit.jupiter.api.Test;

import static com.docfusion.core.Fixtures.JVM;
import static com.docfusion.core.Fixtures.facts;
import static com.docfusion.core.Fixtures.module;
import static com.docfusion.core.Fixtures.pkg;
import static com.docfusion.core.Fixtures.type;
import static org.assertj.core.api.Assertions.*;

class DeprecatedDocumentableFilterTest {

    private final DeprecatedDocumentableFilter filter = new DeprecatedDocumentableFilter();

    private final Module module = module("lib", JVM, pkg("p", JVM,
        type("p.Old", DocumentableKind.CLASS, JVM, facts("old", Visibility.PUBLIC, true)),
        type("p.New", DocumentableKind.CLASS, JVM, facts("new", Visibility.PUBLIC, false))));

    @Test
    void transform_withSkipDeprecated_dropsDeprecatedDeclarations() {
        // Given
        PassConfig pass = Fixtures.pass(JVM, null, null, true, null, null, null);

        // When
        Module result = filter.transform(module, Fixtures.context(Fixtures.config(pass), new RecordingDocLogger()));

        // Then
        assertThat(result.findPackage("p").orElseThrow().children())
            .extracting(Documentable::name).containsExactly("New");
    }

    @Test
    void transform_byDefault_keepsDeprecatedDeclarations() {
        Module result = filter.transform(module, Fixtures.context(JVM));

        assertThat(result).isEqualTo(module);
    }
}
