package com.docfusion.core.translator.impl;

import com.docfusion.core.Fixtures;
import com.docfusion.core.SourceTreeTestBase;
import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.config.PassConfig;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.model.Visibility;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JavaSourceTranslatorTest extends SourceTreeTestBase {

    private final JavaSourceTranslator translator = new JavaSourceTranslator();

    private Module translate() {
        return translate(null);
    }

    private Module translate(List<String> samples) {
        PassConfig pass = new PassConfig("lib", "jvm", null, List.of("src"), null, samples, null, "17", null,
            null, null, null, null, null, null, null, null);
        PlatformContext platform = analyze(pass);
        return translator.translate(platform, Fixtures.context(platform.platformData()));
    }

    private static Documentable member(Documentable owner, String name, String signature) {
        return owner.child(owner.id().child(name, signature))
            .orElseThrow(() -> new AssertionError("No member " + name + signature + " in " + owner.id()));
    }

    private static PlatformFacts facts(Documentable documentable) {
        return documentable.facts().values().iterator().next();
    }

    @Test
    void translate_classWithMembers_mapsKindsSignaturesAndDocumentation() throws IOException {
        // Given
        createFile("src/com/example/Cache.java", """
            package com.example;

            import java.util.List;

            /** Cache of values. */
            public class Cache {
                /** Maximum size. */
                public static final int MAX = 10, MIN = 1;

                public Cache(int size) {}

                /** Looks up a value. */
                public String get(String key) { return null; }

                public void putAll(List<String> keys, String... values) {}

                void internal() {}
            }
            """);

        // When
        Module module = translate();

        // Then
        Documentable pkg = module.findPackage("com.example").orElseThrow();
        Documentable cache = pkg.child(DocumentableId.of("com.example.Cache")).orElseThrow();
        assertThat(cache.kind()).isEqualTo(DocumentableKind.CLASS);
        assertThat(facts(cache).documentation()).isEqualTo("Cache of values.");
        assertThat(facts(cache).location().line()).isEqualTo(6);
        assertThat(facts(cache).location().path()).endsWith("src/com/example/Cache.java");

        assertThat(member(cache, "MAX", "").kind()).isEqualTo(DocumentableKind.PROPERTY);
        assertThat(facts(member(cache, "MAX", "")).documentation()).isEqualTo("Maximum size.");
        assertThat(member(cache, "MIN", "").kind()).isEqualTo(DocumentableKind.PROPERTY);
        assertThat(member(cache, "Cache", "(int)").kind()).isEqualTo(DocumentableKind.CONSTRUCTOR);
        assertThat(facts(member(cache, "get", "(String)")).documentation()).isEqualTo("Looks up a value.");
        assertThat(member(cache, "putAll", "(List<String>,String...)").kind()).isEqualTo(DocumentableKind.FUNCTION);
        assertThat(facts(member(cache, "internal", "()")).visibility()).isEqualTo(Visibility.PACKAGE_PRIVATE);
    }

    @Test
    void translate_interfaceMembers_arePublicWithoutModifier() throws IOException {
        createFile("src/com/example/Store.java", """
            package com.example;

            interface Store {
                String get(String key);

                class Entry {}
            }
            """);

        Documentable store = translate().findPackage("com.example").orElseThrow()
            .child(DocumentableId.of("com.example.Store")).orElseThrow();

        assertThat(store.kind()).isEqualTo(DocumentableKind.INTERFACE);
        assertThat(facts(store).visibility()).isEqualTo(Visibility.PACKAGE_PRIVATE);
        assertThat(facts(member(store, "get", "(String)")).visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(member(store, "Entry", "").kind()).isEqualTo(DocumentableKind.CLASS);
        assertThat(facts(member(store, "Entry", "")).visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(member(store, "Entry", "").parent()).isEqualTo(store.id());
    }

    @Test
    void translate_enumsRecordsAndAnnotations() throws IOException {
        // Given
        createFile("src/com/example/Mode.java", """
            package com.example;
            public enum Mode { READ, WRITE; public boolean writable() { return this == WRITE; } }
            """);
        createFile("src/com/example/Point.java", """
            package com.example;
            public record Point(int x, int y) {}
            """);
        createFile("src/com/example/Marker.java", """
            package com.example;
            public @interface Marker { String value(); }
            """);

        // When
        Documentable pkg = translate().findPackage("com.example").orElseThrow();

        // Then
        Documentable mode = pkg.child(DocumentableId.of("com.example.Mode")).orElseThrow();
        assertThat(mode.kind()).isEqualTo(DocumentableKind.ENUM);
        assertThat(mode.children()).extracting(Documentable::name).containsExactly("READ", "WRITE", "writable");
        assertThat(member(mode, "READ", "").kind()).isEqualTo(DocumentableKind.ENUM_ENTRY);

        Documentable point = pkg.child(DocumentableId.of("com.example.Point")).orElseThrow();
        assertThat(point.kind()).isEqualTo(DocumentableKind.RECORD);
        assertThat(point.children()).extracting(Documentable::kind)
            .containsExactly(DocumentableKind.PROPERTY, DocumentableKind.PROPERTY);

        Documentable marker = pkg.child(DocumentableId.of("com.example.Marker")).orElseThrow();
        assertThat(marker.kind()).isEqualTo(DocumentableKind.ANNOTATION);
        assertThat(member(marker, "value", "()").kind()).isEqualTo(DocumentableKind.FUNCTION);
    }

    @Test
    void translate_deprecatedByAnnotationOrJavadocTag() throws IOException {
        createFile("src/p/Legacy.java", """
            package p;
            public class Legacy {
                @Deprecated
                public void annotated() {}

                /**
                 * Old entry point.
                 * @deprecated use annotated
                 */
                public void tagged() {}

                public void current() {}
            }
            """);

        Documentable legacy = translate().findPackage("p").orElseThrow()
            .child(DocumentableId.of("p.Legacy")).orElseThrow();

        assertThat(facts(member(legacy, "annotated", "()")).deprecated()).isTrue();
        assertThat(facts(member(legacy, "annotated", "()")).annotations()).containsExactly("Deprecated");
        assertThat(facts(member(legacy, "tagged", "()")).deprecated()).isTrue();
        assertThat(facts(member(legacy, "tagged", "()")).documentation()).isEqualTo("Old entry point.");
        assertThat(facts(member(legacy, "current", "()")).deprecated()).isFalse();
    }

    @Test
    void translate_packageInfo_documentsPackage() throws IOException {
        createFile("src/p/package-info.java", """
            /** Utilities for p. */
            package p;
            """);
        createFile("src/p/Tool.java", "package p; public class Tool {}");

        Documentable pkg = translate().findPackage("p").orElseThrow();

        assertThat(pkg.kind()).isEqualTo(DocumentableKind.PACKAGE);
        assertThat(facts(pkg).documentation()).isEqualTo("Utilities for p.");
        assertThat(pkg.children()).extracting(Documentable::name).containsExactly("Tool");
    }

    @Test
    void translate_filesOfSamePackage_foldIntoOnePackage() throws IOException {
        createFile("src/a/p/One.java", "package p; public class One {}");
        createFile("src/b/p/Two.java", "package p; public class Two {}");
        createFile("src/Root.java", "public class Root {}");

        Module module = translate();

        assertThat(module.name()).isEqualTo("lib");
        assertThat(module.packages()).extracting(Documentable::name)
            .containsExactlyInAnyOrder("p", ModuleAssembler.ROOT_PACKAGE_NAME);
        assertThat(module.findPackage("p").orElseThrow().children()).extracting(Documentable::name)
            .containsExactly("One", "Two");
    }

    @Test
    void translate_duplicateDeclarations_areReportedAndDropped() throws IOException {
        // Given
        createFile("src/a/Cache.java", """
            package p;
            public class Cache {
                public void clear(int level) {}
                public void clear(int other) {}
            }
            """);
        createFile("src/b/Cache.java", "package p; public class Cache {}");

        // When
        Documentable pkg = translate().findPackage("p").orElseThrow();

        // Then
        Documentable cache = pkg.children().get(0);
        assertThat(pkg.children()).hasSize(1);
        assertThat(cache.children()).hasSize(1);
        assertThat(logger.infos())
            .anyMatch(message -> message.contains("Duplicate declaration p.Cache.clear(int) ignored"))
            .anyMatch(message -> message.contains("Duplicate declaration p.Cache ignored"));
    }

    @Test
    void translate_supertypes_areQualifiedThroughImportsJavaLangAndOwnPackage() throws IOException {
        // Given
        createFile("src/com/example/Cache.java", """
            package com.example;

            import java.io.Closeable;
            import java.util.Map;

            public class Cache extends AbstractStore<String> implements Closeable, Comparable<Cache>,
                    Map.Entry<String, String>, java.io.Serializable {
            }
            """);
        createFile("src/com/example/Mode.java", "package com.example; public enum Mode implements Runnable { ON }");

        // When
        Documentable pkg = translate().findPackage("com.example").orElseThrow();

        // Then
        assertThat(facts(pkg.child(DocumentableId.of("com.example.Cache")).orElseThrow()).supertypes())
            .containsExactly("com.example.AbstractStore", "java.io.Closeable", "java.lang.Comparable",
                "java.util.Map.Entry", "java.io.Serializable");
        assertThat(facts(pkg.child(DocumentableId.of("com.example.Mode")).orElseThrow()).supertypes())
            .containsExactly("java.lang.Runnable");
    }

    @Test
    void translate_sampleTag_appendsSampleBodyAsCodeBlock() throws IOException {
        // Given
        createFile("samples/com/example/CacheSamples.java", """
            package com.example;

            class CacheSamples {
                void put() {
                    Cache cache = new Cache();
                    cache.put("k", "v");
                }
            }
            """);
        createFile("src/com/example/Cache.java", """
            package com.example;

            public class Cache {
                /**
                 * Stores a value.
                 *
                 * @sample com.example.CacheSamples#put
                 */
                public void put(String key, String value) {}

                /**
                 * Removes a value.
                 *
                 * @sample com.example.CacheSamples#missing
                 */
                public void remove(String key) {}
            }
            """);

        // When
        Documentable cache = translate(List.of("samples")).findPackage("com.example").orElseThrow()
            .child(DocumentableId.of("com.example.Cache")).orElseThrow();

        // Then
        assertThat(facts(member(cache, "put", "(String,String)")).documentation()).isEqualTo(
            "Stores a value.\n\n```java\nCache cache = new Cache();\ncache.put(\"k\", \"v\");\n```");
        assertThat(facts(member(cache, "remove", "(String)")).documentation()).isEqualTo("Removes a value.");
        assertThat(logger.infos()).anyMatch(message -> message.startsWith("warning: ")
            && message.contains("Unresolved sample reference com.example.CacheSamples#missing"));
    }
}
