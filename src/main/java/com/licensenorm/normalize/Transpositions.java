package com.licensenorm.normalize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 已知全称、错拼与冗余后缀的替换表，按源串长度降序排列，长度相同时按字典序。
 */
final class Transpositions {

    record Transposition(String from, String fromUpper, String to, Pattern pattern) {

        Transposition(String from, String to) {
            this(from, from.toUpperCase(Locale.ROOT), to,
                    Pattern.compile(Pattern.quote(from), Pattern.CASE_INSENSITIVE));
        }

        /**
         * 判断短语是否包含源串（先区分大小写，再按大写比较）。
         */
        boolean appliesTo(String phrase, String phraseUpper) {
            return phrase.contains(from) || phraseUpper.contains(fromUpper);
        }

        /**
         * 替换全部出现；区分大小写替换无变化时改用不区分大小写替换。
         */
        String apply(String phrase) {
            String corrected = phrase.replace(from, to);
            if (corrected.equals(phrase)) {
                corrected = pattern.matcher(phrase).replaceAll(Matcher.quoteReplacement(to));
            }
            return corrected;
        }
    }

    static final List<Transposition> ORDERED = sorted(List.of(
        new Transposition("The Apache Software License, Version 2.0", "Apache-2.0"),
        new Transposition("The Apache License, Version 2.0", "Apache-2.0"),
        new Transposition("Apache Software License, Version 2.0", "Apache-2.0"),
        new Transposition("Apache License, Version 2.0", "Apache-2.0"),
        new Transposition("The Apache Software License", "Apache"),
        new Transposition("Apache Software License", "Apache"),
        new Transposition("The MIT License", "MIT"),
        new Transposition("GNU Lesser General Public License v3.0", "LGPL-3.0"),
        new Transposition("GNU Lesser General Public License v3", "LGPL-3.0"),
        new Transposition("GNU Lesser General Public License v2.1", "LGPL-2.1"),
        new Transposition("GNU Lesser General Public License v2.0", "LGPL-2.0"),
        new Transposition("GNU Lesser General Public License v2", "LGPL-2.0"),
        new Transposition("GNU LESSER GENERAL PUBLIC LICENSE", "LGPL-2.1"),
        new Transposition("GNU Lesser General Public License", "LGPL-2.1"),
        new Transposition("Lesser General Public License", "LGPL-2.1"),
        new Transposition("LESSER GENERAL PUBLIC LICENSE", "LGPL-2.1"),
        new Transposition("GNU AFFERO GENERAL PUBLIC LICENSE", "AGPL"),
        new Transposition("AFFERO GENERAL PUBLIC LICENSE", "AGPL"),
        new Transposition("GNU GENERAL PUBLIC LICENSE", "GPL"),
        new Transposition("GNU General Public License", "GPL"),
        new Transposition("Gnu public license", "GPL"),
        new Transposition("GNU Public License", "GPL"),
        new Transposition("Mozilla Public License", "MPL"),
        new Transposition("Universal Permissive License", "UPL"),
        new Transposition("Eclipse Public License", "EPL"),
        new Transposition(" or later", "+"),
        new Transposition("-or-later", "+"),
        new Transposition(" International", ""),
        new Transposition("GNU LGPL", "LGPL"),
        new Transposition("GNU GPL", "GPL"),
        new Transposition("GNU/GPL", "GPL"),
        new Transposition("GNU GLP", "GPL"),
        new Transposition("GNU/GPLv", "GPLv"),
        new Transposition(" License", ""),
        new Transposition("-License", ""),
        new Transposition("WTFGPL", "WTFPL"),
        new Transposition("APGL", "AGPL"),
        new Transposition("GLP", "GPL"),
        new Transposition("APLv", "Apache-"),
        new Transposition("APL", "Apache"),
        new Transposition("ISD", "ISC"),
        new Transposition("IST", "ISC"),
        new Transposition("MTI", "MIT"),
        new Transposition("GNU", "GPL"),
        new Transposition("GUN", "GPL"),
        new Transposition("Gpl", "GPL"),
        new Transposition("WTH", "WTF"),
        new Transposition("Claude", "Clause"),
        new Transposition("+", "")
    ));

    private Transpositions() {
    }

    private static List<Transposition> sorted(List<Transposition> table) {
        List<Transposition> ordered = new ArrayList<>(table);
        ordered.sort(Comparator.comparingInt((Transposition t) -> t.from().length()).reversed()
                .thenComparing(Transposition::from));
        return List.copyOf(ordered);
    }
}
