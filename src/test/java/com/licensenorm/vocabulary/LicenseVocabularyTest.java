package com.licensenorm.vocabulary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LicenseVocabularyTest {

    private final LicenseVocabulary vocabulary = LicenseVocabulary.defaultVocabulary();

    @Test
    @DisplayName("查找不区分大小写并返回规范拼写")
    void testCaseInsensitiveLookup() {
        assertEquals(Optional.of("Apache-2.0"), vocabulary.lookupLicense("APACHE-2.0"));
        assertEquals(Optional.of("BSD-3-Clause"), vocabulary.lookupLicense("bsd-3-clause"));
        assertEquals(Optional.of("Classpath-exception-2.0"), vocabulary.lookupException("classpath-EXCEPTION-2.0"));
    }

    @Test
    @DisplayName("废弃标识符可查但单独标记")
    void testDeprecatedIdentifiers() {
        assertEquals(Optional.of("GPL-2.0"), vocabulary.lookupLicense("gpl-2.0"));
        assertTrue(vocabulary.isDeprecated("GPL-2.0+"));
        assertFalse(vocabulary.isDeprecated("GPL-2.0-only"));
    }

    @Test
    void testLicensesAndExceptionsAreSeparate() {
        assertFalse(vocabulary.isLicense("Classpath-exception-2.0"));
        assertFalse(vocabulary.isException("MIT"));
        assertTrue(vocabulary.lookupLicense("").isEmpty());
        assertTrue(vocabulary.lookupException(null).isEmpty());
    }

    @Test
    void testDefaultVocabularyIsShared() {
        assertSame(vocabulary, LicenseVocabulary.defaultVocabulary());
        assertEquals("3.22", vocabulary.getLicenseListVersion());
        assertTrue(vocabulary.licenseCount() > 500);
        assertTrue(vocabulary.exceptionCount() > 40);
    }

    @Test
    void testExplicitVocabulary() {
        LicenseVocabulary small = LicenseVocabulary.of(List.of("MIT"), List.of("GPL-2.0"), List.of("LLVM-exception"));
        assertTrue(small.isLicense("mit"));
        assertTrue(small.isLicense("GPL-2.0"));
        assertFalse(small.isLicense("Apache-2.0"));
        assertEquals(2, small.licenseCount());
        assertEquals("unknown", small.getLicenseListVersion());
    }

    @Test
    void testMissingResourceFails() {
        assertThrows(IllegalStateException.class, () -> LicenseVocabulary.load("/spdx/missing.json"));
    }
}
