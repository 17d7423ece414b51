package com.licensenorm.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NormalizationRulesTest {

    @ParameterizedTest
    @CsvSource({
        "GPL-2.0, GPL-2.0-only",
        "LGPL-2.1, LGPL-2.1-only",
        "AGPL-1.0, AGPL-1.0-only",
        "GPL-3.0, GPL-3.0-or-later",
        "LGPL-3.0, LGPL-3.0-or-later",
        "GPL-2.0+, GPL-2.0-or-later",
        "AGPL-3.0+, AGPL-3.0-or-later",
        "GPL-2.0-only, GPL-2.0-only",
        "Apache-2.0+, Apache-2.0+",
        "MIT, MIT"
    })
    @DisplayName("废弃标识符升级")
    void testUpgrade(String input, String expected) {
        assertEquals(expected, DeprecatedUpgrades.upgrade(input));
    }

    @Test
    void testUpgradeIsIdempotent() {
        for (String id : List.of("GPL-2.0", "GPL-3.0+", "LGPL-2.1", "MIT")) {
            String once = DeprecatedUpgrades.upgrade(id);
            assertEquals(once, DeprecatedUpgrades.upgrade(once));
        }
    }

    @Test
    @DisplayName("替换表按源串长度降序排列")
    void testTranspositionOrdering() {
        List<Transpositions.Transposition> ordered = Transpositions.ORDERED;
        for (int i = 1; i < ordered.size(); i++) {
            String previous = ordered.get(i - 1).from();
            String current = ordered.get(i).from();
            assertTrue(previous.length() > current.length()
                    || (previous.length() == current.length() && previous.compareTo(current) < 0),
                    previous + " / " + current);
        }
        assertEquals("The Apache Software License, Version 2.0", ordered.get(0).from());
        assertEquals("+", ordered.get(ordered.size() - 1).from());
    }

    @Test
    void testTranspositionFallsBackToCaseInsensitiveReplace() {
        Transpositions.Transposition transposition = new Transpositions.Transposition("GNU GPL", "GPL");
        assertEquals("GPL v2", transposition.apply("gnu gpl v2"));
        assertEquals("GPL v2", transposition.apply("GNU GPL v2"));
        assertTrue(transposition.appliesTo("gnu gpl v2", "GNU GPL V2"));
    }

    @Test
    @DisplayName("子串兜底优先匹配更长的子串")
    void testLastResortPrefersLongerSubstring() {
        assertEquals(Optional.of("LGPL-3.0-or-later"), LastResorts.find("some lgpl thing"));
        assertEquals(Optional.of("AGPL-3.0-or-later"), LastResorts.find("agpl"));
        assertEquals(Optional.of("MITNFA"), LastResorts.find("MIT +no-false-attribs"));
        assertEquals(Optional.of("BSD-3-Clause"), LastResorts.find("The BSD 3-Clause License"));
        assertTrue(LastResorts.find("nothing here").isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "FreeBSD License, BSD-2-Clause-FreeBSD",
        "net bsd, BSD-2-Clause-NetBSD",
        "plain text, plain text"
    })
    void testFreeOrNetBsd(String input, String expected) {
        assertEquals(expected, LicenseTransforms.freeOrNetBsd(input));
    }

    @ParameterizedTest
    @CsvSource({
        "Attribution-NonCommercial, CC-BY-NC-4.0",
        "Attribution-ShareAlike 3.0, CC-BY-SA-3.0",
        "CC-BY 4.0 International, CC-BY-4.0",
        "MIT, MIT"
    })
    void testCreativeCommons(String input, String expected) {
        assertEquals(expected, LicenseTransforms.creativeCommons(input));
    }
}
