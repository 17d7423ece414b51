package com.licensenorm.normalize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 子串兜底映射：大写短语包含某子串即视为对应许可证。
 * 按子串长度降序排列，长度相同时按字典序，保证更具体的子串先命中。
 */
final class LastResorts {

    record LastResort(String substring, String license) {
    }

    static final List<LastResort> ORDERED = sorted(List.of(
        new LastResort("MIT +NO-FALSE-ATTRIBS", "MITNFA"),
        new LastResort("PUBLIC DOMAIN", "Unlicense"),
        new LastResort("PUBLIC-DOMAIN", "Unlicense"),
        new LastResort("PUBLICDOMAIN", "Unlicense"),
        new LastResort("ECLIPSE PUBLIC LICENSE 2", "EPL-2.0"),
        new LastResort("ECLIPSE PUBLIC LICENSE, VERSION 2", "EPL-2.0"),
        new LastResort("ECLIPSE PUBLIC LICENSE V2", "EPL-2.0"),
        new LastResort("EPL-2", "EPL-2.0"),
        new LastResort("EPL 2", "EPL-2.0"),
        new LastResort("EPL2", "EPL-2.0"),
        new LastResort("ECLIPSE PUBLIC LICENSE 1", "EPL-1.0"),
        new LastResort("EPL-1", "EPL-1.0"),
        new LastResort("EPL 1", "EPL-1.0"),
        new LastResort("EPL1", "EPL-1.0"),
        new LastResort("ASL-2", "Apache-2.0"),
        new LastResort("ASL 2", "Apache-2.0"),
        new LastResort("ASL2", "Apache-2.0"),
        new LastResort("ALV2", "Apache-2.0"),
        new LastResort("AL2", "Apache-2.0"),
        new LastResort("ASL", "Apache-2.0"),
        new LastResort("2 CLAUSE", "BSD-2-Clause"),
        new LastResort("2-CLAUSE", "BSD-2-Clause"),
        new LastResort("3 CLAUSE", "BSD-3-Clause"),
        new LastResort("3-CLAUSE", "BSD-3-Clause"),
        new LastResort("AFFERO", "AGPL-3.0-or-later"),
        new LastResort("AGPL", "AGPL-3.0-or-later"),
        new LastResort("LGPL2.1+", "LGPL-2.1-or-later"),
        new LastResort("LGPL2.1", "LGPL-2.1-only"),
        new LastResort("LGPLV2.1", "LGPL-2.1-only"),
        new LastResort("LGPLV2", "LGPL-2.0-only"),
        new LastResort("LGPL-2", "LGPL-2.0-only"),
        new LastResort("LGPL", "LGPL-3.0-or-later"),
        new LastResort("GPLV1", "GPL-1.0-only"),
        new LastResort("GPL-1", "GPL-1.0-only"),
        new LastResort("GPLV2", "GPL-2.0-only"),
        new LastResort("GPL-2", "GPL-2.0-only"),
        new LastResort("GPL", "GPL-3.0-or-later"),
        new LastResort("GNU", "GPL-3.0-or-later"),
        new LastResort("APACHE", "Apache-2.0"),
        new LastResort("ARTISTIC_2", "Artistic-2.0"),
        new LastResort("ARTISTIC-2", "Artistic-2.0"),
        new LastResort("ARTISTIC 2", "Artistic-2.0"),
        new LastResort("ARTISTIC_1", "Artistic-1.0"),
        new LastResort("ARTISTIC-1", "Artistic-1.0"),
        new LastResort("ARTISTIC 1", "Artistic-1.0"),
        new LastResort("ARTISTIC", "Artistic-2.0"),
        new LastResort("BEER", "Beerware"),
        new LastResort("BOOST", "BSL-1.0"),
        new LastResort("BSD", "BSD-2-Clause"),
        new LastResort("CC0", "CC0-1.0"),
        new LastResort("CDDL", "CDDL-1.1"),
        new LastResort("ECLIPSE", "EPL-1.0"),
        new LastResort("EPL", "EPL-1.0"),
        new LastResort("FUCK", "WTFPL"),
        new LastResort("MIT", "MIT"),
        new LastResort("MPL", "MPL-2.0"),
        new LastResort("UNLI", "Unlicense"),
        new LastResort("UPL", "UPL-1.0"),
        new LastResort("WTF", "WTFPL"),
        new LastResort("X11", "X11"),
        new LastResort("ZLIB", "Zlib"),
        new LastResort("ISCL", "ISC"),
        new LastResort("ICS", "ISC"),
        new LastResort("ISC", "ISC"),
        new LastResort("OPEN FONT", "OFL-1.1"),
        new LastResort("OFL", "OFL-1.1"),
        new LastResort("PHP-3", "PHP-3.01"),
        new LastResort("PHP", "PHP-3.01"),
        new LastResort("PYTHON SOFTWARE FOUNDATION", "PSF-2.0"),
        new LastResort("PSF-2", "PSF-2.0"),
        new LastResort("PSF", "PSF-2.0"),
        new LastResort("PYTHON", "Python-2.0"),
        new LastResort("PERL_5", "Artistic-1.0-Perl"),
        new LastResort("PERL5", "Artistic-1.0-Perl"),
        new LastResort("PERL 5", "Artistic-1.0-Perl"),
        new LastResort("ZPL", "ZPL-2.1"),
        new LastResort("EUROPEAN UNION PUBLIC", "EUPL-1.2"),
        new LastResort("EUPL", "EUPL-1.2"),
        new LastResort("WXWINDOWS", "wxWindows"),
        new LastResort("WXWIDGETS", "wxWindows")
    ));

    private LastResorts() {
    }

    /**
     * 返回第一个被短语（大写后）包含的子串对应的许可证。
     */
    static Optional<String> find(String phrase) {
        String upper = phrase.toUpperCase(Locale.ROOT);
        for (LastResort lastResort : ORDERED) {
            if (upper.contains(lastResort.substring())) {
                return Optional.of(lastResort.license());
            }
        }
        return Optional.empty();
    }

    private static List<LastResort> sorted(List<LastResort> table) {
        List<LastResort> ordered = new ArrayList<>(table);
        ordered.sort(Comparator.comparingInt((LastResort r) -> r.substring().length()).reversed()
                .thenComparing(LastResort::substring));
        return List.copyOf(ordered);
    }
}
