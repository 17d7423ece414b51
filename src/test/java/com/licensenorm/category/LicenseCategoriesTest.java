package com.licensenorm.category;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class LicenseCategoriesTest {

    private final LicenseCategories categories = LicenseCategories.defaultCategories();

    @ParameterizedTest
    @CsvSource({
        "MIT, PERMISSIVE",
        "Apache-2.0, PERMISSIVE",
        "BSD-2-Clause, PERMISSIVE",
        "BSD-3-Clause, PERMISSIVE",
        "ISC, PERMISSIVE",
        "GPL-2.0-only, COPYLEFT",
        "GPL-3.0-only, COPYLEFT",
        "GPL-3.0-or-later, COPYLEFT",
        "AGPL-3.0-only, COPYLEFT",
        "LGPL-2.1-only, COPYLEFT_LIMITED",
        "LGPL-3.0-only, COPYLEFT_LIMITED",
        "MPL-2.0, COPYLEFT_LIMITED",
        "EPL-2.0, COPYLEFT_LIMITED",
        "Unlicense, PUBLIC_DOMAIN",
        "CC0-1.0, PUBLIC_DOMAIN",
        "mit, PERMISSIVE",
        "GPL-2.0, COPYLEFT"
    })
    @DisplayName("常见许可证分类")
    void testCategoryOf(String license, LicenseCategory expected) {
        assertEquals(expected, categories.categoryOf(license));
    }

    @Test
    @DisplayName("去掉 -only / -or-later 后再查")
    void testSuffixStripping() {
        assertEquals(LicenseCategory.COPYLEFT_LIMITED, categories.categoryOf("MPL-2.0-or-later"));
        assertEquals(LicenseCategory.PERMISSIVE, categories.categoryOf("Apache-2.0-only"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"FAKE-LICENSE", "", "LicenseRef-whatever"})
    void testUnknownLicenses(String license) {
        assertEquals(LicenseCategory.UNKNOWN, categories.categoryOf(license));
    }

    @Test
    void testCategoryPredicates() {
        assertTrue(categories.isPermissive("MIT"));
        assertTrue(categories.isPermissive("Unlicense"));
        assertFalse(categories.isPermissive("GPL-3.0-only"));
        assertTrue(categories.isCopyleft("LGPL-2.1-only"));
        assertFalse(categories.isCopyleft("MIT"));
        assertTrue(categories.isCommercial("LicenseRef-scancode-commercial-license"));
        assertFalse(categories.isCommercial("MIT"));
    }

    @Test
    void testLicenseInfo() {
        LicenseInfo info = categories.licenseInfo("classpath-exception-2.0").orElseThrow();
        assertTrue(info.exception());
        assertEquals("Classpath-exception-2.0", info.spdxLicenseKey());
        assertTrue(categories.licenseInfo("FAKE-LICENSE").isEmpty());
    }

    @Test
    @DisplayName("分类资源缺失时退化为空表")
    void testMissingResourceDegradesToEmptyTable() {
        LicenseCategories empty = LicenseCategories.load("/spdx/missing-categories.json");
        assertEquals(0, empty.size());
        assertEquals(LicenseCategory.UNKNOWN, empty.categoryOf("MIT"));
    }

    @Test
    void testExplicitRecordsIndexAliases() {
        LicenseInfo record = new LicenseInfo("gpl-2.0", "Copyleft", "GPL-2.0-only",
                List.of("GPL-2.0", "LicenseRef-GPL-2.0"), false, false);
        LicenseCategories table = LicenseCategories.of(List.of(record));
        assertEquals(LicenseCategory.COPYLEFT, table.categoryOf("GPL-2.0"));
        assertEquals(LicenseCategory.UNKNOWN, table.categoryOf("LicenseRef-GPL-2.0"));
    }

    @Test
    void testLabels() {
        assertEquals("Copyleft Limited", LicenseCategory.COPYLEFT_LIMITED.label());
        assertEquals(LicenseCategory.SOURCE_AVAILABLE, LicenseCategory.fromLabel("Source-available"));
        assertEquals(LicenseCategory.UNKNOWN, LicenseCategory.fromLabel("Nonsense"));
        assertEquals(LicenseCategory.UNKNOWN, LicenseCategory.fromLabel(null));
    }
}
