package com.licensenorm.normalize;

import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单步字符串变换规则
 * 
 * 每条规则独立作用于原始短语，不会串联。顺序决定优先级。
 */
final class LicenseTransforms {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGIT = Pattern.compile(",?\\s*(\\d)");
    private static final Pattern DIGIT_END = Pattern.compile(",?\\s*(\\d)$");
    private static final Pattern VERSION = Pattern.compile("(?i),?\\s*(V\\.?|Version)\\s*(\\d)");
    private static final Pattern VERSION_END = Pattern.compile("(?i),?\\s*(V\\.?|Version)\\s*(\\d)$");
    private static final Pattern TRAILING_DIGIT = Pattern.compile("(\\d)$");
    private static final Pattern BSD_NUMBER = Pattern.compile("(?i)(-|\\s)?(\\d)$");
    private static final Pattern BSD_CLAUSE = Pattern.compile("(?i)(-|\\s)clause(-|\\s)(\\d)");
    private static final Pattern NEW_BSD = Pattern.compile("(?i)\\b(Modified|New|Revised)(-|\\s)?BSD((-|\\s)License)?");
    private static final Pattern SIMPLIFIED_BSD = Pattern.compile("(?i)\\bSimplified(-|\\s)?BSD((-|\\s)License)?");
    private static final Pattern FREE_NET_BSD = Pattern.compile("(?i)\\b(Free|Net)(-|\\s)?BSD((-|\\s)Licen[sc]e)?");
    private static final Pattern CLEAR_BSD = Pattern.compile("(?i)\\bClear(-|\\s)?BSD((-|\\s)License)?");
    private static final Pattern OLD_BSD = Pattern.compile("(?i)\\b(Old|Original)(-|\\s)?BSD((-|\\s)License)?");
    private static final Pattern CC_SPACE_DIGIT = Pattern.compile("\\s+(\\d)");
    private static final Pattern CC_VERSION = Pattern.compile("\\d\\.\\d");

    static final List<UnaryOperator<String>> ORDERED = List.of(
        s -> s.toUpperCase(Locale.ROOT),
        String::trim,
        s -> s.replace(".", ""),
        s -> WHITESPACE.matcher(s).replaceAll(""),
        s -> WHITESPACE.matcher(s).replaceAll("-"),
        s -> s.replaceFirst("v", "-"),
        s -> DIGIT.matcher(s).replaceAll("-$1"),
        s -> DIGIT_END.matcher(s).replaceAll("-$1.0"),
        s -> VERSION.matcher(s).replaceAll("-$2"),
        s -> VERSION_END.matcher(s).replaceAll("-$2.0"),
        LicenseTransforms::capitalize,
        s -> s.replace("/", "-"),
        s -> s.contains("3.0") ? s + "-or-later" : s + "-only",
        s -> s.endsWith("-") ? s + "only" : s,
        s -> TRAILING_DIGIT.matcher(s).replaceAll("-$1.0"),
        s -> BSD_NUMBER.matcher(s).replaceAll("-$2-Clause"),
        s -> BSD_CLAUSE.matcher(s).replaceAll("-$3-Clause"),
        s -> NEW_BSD.matcher(s).replaceAll("BSD-3-Clause"),
        s -> SIMPLIFIED_BSD.matcher(s).replaceAll("BSD-2-Clause"),
        LicenseTransforms::freeOrNetBsd,
        s -> CLEAR_BSD.matcher(s).replaceAll("BSD-3-Clause-Clear"),
        s -> OLD_BSD.matcher(s).replaceAll("BSD-4-Clause"),
        s -> s.toUpperCase(Locale.ROOT).startsWith("BY-") ? "CC-" + s : s,
        LicenseTransforms::creativeCommons
    );

    private LicenseTransforms() {
    }

    static String capitalize(String s) {
        if (s.isEmpty()) {
            return s;
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }

    /**
     * FreeBSD / NetBSD 变体整体替换为 BSD-2-Clause-FreeBSD 或 BSD-2-Clause-NetBSD。
     */
    static String freeOrNetBsd(String s) {
        Matcher matcher = FREE_NET_BSD.matcher(s);
        if (!matcher.find()) {
            return s;
        }
        return "BSD-2-Clause-" + capitalize(matcher.group(1).toLowerCase(Locale.ROOT)) + "BSD";
    }

    /**
     * Creative Commons 全称改写为缩写，缺版本号时补 4.0。
     */
    static String creativeCommons(String s) {
        String result = s.replace("Attribution", "BY")
                .replace("NonCommercial", "NC")
                .replace("NoDerivatives", "ND")
                .replace("ShareAlike", "SA");
        result = CC_SPACE_DIGIT.matcher(result).replaceAll("-$1");
        result = result.replace(" International", "");
        if (result.equals(s) || result.startsWith("CC-")) {
            return result;
        }
        result = "CC-" + result;
        if (!CC_VERSION.matcher(result).find()) {
            result = result + "-4.0";
        }
        return result;
    }
}
