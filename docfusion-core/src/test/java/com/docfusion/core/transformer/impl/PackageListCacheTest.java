package com.docfusion.core.transformer.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PackageListCacheTest {

    @Test
    void parse_acceptsPackageListAndElementListFormats() {
        String elementList = """
            module:java.base
            java.io
            java.util

            module:java.sql
            java.sql
            """;

        assertThat(PackageListCache.parse(elementList)).containsExactly("java.io", "java.util", "java.sql");
    }

    @Test
    void cacheFileName_replacesCharactersUnsafeForFileNames() {
        assertThat(PackageListCache.cacheFileName("https://docs.example.org/api/package-list?v=2"))
            .isEqualTo("https___docs.example.org_api_package-list_v_2");
    }
}
