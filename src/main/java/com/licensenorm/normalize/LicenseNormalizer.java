package com.licensenorm.normalize;

import com.licensenorm.ErrorKind;
import com.licensenorm.LicenseExpressionException;
import com.licensenorm.config.Constants;
import com.licensenorm.vocabulary.LicenseVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 将非正式许可证名称映射为 SPDX 规范标识符
 * 
 * 依次尝试：精确查找、去 "+" 查找、单步变换、替换表、子串兜底、替换表加子串兜底。
 * 任一层命中即返回，结果都经过废弃标识符升级。
 */
public class LicenseNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(LicenseNormalizer.class);

    private final LicenseVocabulary vocabulary;

    public LicenseNormalizer(LicenseVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public LicenseVocabulary getVocabulary() {
        return vocabulary;
    }

    /**
     * 规范化单个许可证短语。
     *
     * @throws LicenseExpressionException 短语为空或无法识别
     */
    public String normalize(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new LicenseExpressionException(ErrorKind.EMPTY_INPUT, "");
        }
        return tryNormalize(phrase)
                .orElseThrow(() -> new LicenseExpressionException(ErrorKind.INVALID_LICENSE_IDENTIFIER, phrase.trim()));
    }

    /**
     * 规范化单个短语，无法识别时返回空。
     */
    public Optional<String> tryNormalize(String phrase) {
        if (phrase == null) {
            return Optional.empty();
        }
        String trimmed = phrase.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        boolean singleWord = trimmed.chars().noneMatch(Character::isWhitespace);
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (singleWord && Constants.SPECIAL_VALUES.contains(upper)) {
            return Optional.of(upper);
        }
        if (singleWord && isReference(upper)) {
            return Optional.of(trimmed);
        }

        Optional<String> exact = vocabulary.lookupLicense(trimmed);
        if (exact.isPresent()) {
            return resolved("exact", trimmed, DeprecatedUpgrades.upgrade(exact.get()));
        }

        if (trimmed.endsWith("+")) {
            Optional<String> base = vocabulary.lookupLicense(trimmed.substring(0, trimmed.length() - 1));
            if (base.isPresent()) {
                return resolved("plus", trimmed, DeprecatedUpgrades.upgrade(base.get() + "+"));
            }
        }

        Optional<String> result = tryTransforms(trimmed);
        if (result.isPresent()) {
            return resolved("transform", trimmed, result.get());
        }
        result = tryTranspositions(trimmed, false);
        if (result.isPresent()) {
            return resolved("transposition", trimmed, result.get());
        }
        result = tryLastResorts(trimmed);
        if (result.isPresent()) {
            return resolved("last-resort", trimmed, result.get());
        }
        result = tryTranspositions(trimmed, true);
        if (result.isPresent()) {
            return resolved("transposition+last-resort", trimmed, result.get());
        }

        logger.debug("无法识别许可证短语: '{}'", trimmed);
        return Optional.empty();
    }

    /**
     * 将词序列切分为若干许可证：从当前位置起优先匹配最长的可规范化片段。
     *
     * @throws LicenseExpressionException 某个位置起的任何片段都无法规范化
     */
    public List<String> normalizeWords(List<String> words) {
        if (words.isEmpty()) {
            throw new LicenseExpressionException(ErrorKind.MISSING_OPERAND, "");
        }

        List<String> results = new ArrayList<>();
        int start = 0;
        while (start < words.size()) {
            boolean matched = false;
            for (int end = words.size(); end > start; end--) {
                String candidate = String.join(" ", words.subList(start, end));
                Optional<String> normalized = tryNormalize(candidate);
                if (normalized.isEmpty() && candidate.endsWith("+")) {
                    normalized = tryNormalize(candidate.substring(0, candidate.length() - 1))
                            .map(base -> DeprecatedUpgrades.upgrade(base + "+"));
                }
                if (normalized.isPresent()) {
                    results.add(normalized.get());
                    start = end;
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                throw new LicenseExpressionException(ErrorKind.INVALID_LICENSE_IDENTIFIER, words.get(start));
            }
        }
        return results;
    }

    private Optional<String> tryTransforms(String phrase) {
        boolean hasPlus = phrase.endsWith("+");
        String base = hasPlus ? phrase.substring(0, phrase.length() - 1) : phrase;

        for (UnaryOperator<String> transform : LicenseTransforms.ORDERED) {
            String transformed = transform.apply(phrase).trim();
            if (!transformed.equals(phrase)) {
                Optional<String> id = vocabulary.lookupLicense(transformed);
                if (id.isPresent()) {
                    return Optional.of(DeprecatedUpgrades.upgrade(id.get()));
                }
            }
            if (hasPlus) {
                String transformedBase = transform.apply(base).trim();
                if (!transformedBase.equals(base)) {
                    Optional<String> id = vocabulary.lookupLicense(transformedBase);
                    if (id.isPresent()) {
                        return Optional.of(DeprecatedUpgrades.upgrade(id.get() + "+"));
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 逐条应用替换表；替换后先精确查找，再按 withLastResorts 选择单步变换或子串兜底。
     */
    private Optional<String> tryTranspositions(String phrase, boolean withLastResorts) {
        String upper = phrase.toUpperCase(Locale.ROOT);
        for (Transpositions.Transposition transposition : Transpositions.ORDERED) {
            if (!transposition.appliesTo(phrase, upper)) {
                continue;
            }
            String corrected = transposition.apply(phrase);
            if (withLastResorts) {
                Optional<String> result = tryLastResorts(corrected);
                if (result.isPresent()) {
                    return result;
                }
                continue;
            }
            Optional<String> id = vocabulary.lookupLicense(corrected);
            if (id.isPresent()) {
                return Optional.of(DeprecatedUpgrades.upgrade(id.get()));
            }
            Optional<String> result = tryTransforms(corrected);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    private Optional<String> tryLastResorts(String phrase) {
        return LastResorts.find(phrase)
                .map(license -> vocabulary.lookupLicense(license).orElse(license))
                .map(DeprecatedUpgrades::upgrade);
    }

    private static boolean isReference(String upper) {
        return upper.startsWith(Constants.LICENSE_REF_PREFIX.toUpperCase(Locale.ROOT))
                || upper.startsWith(Constants.DOCUMENT_REF_PREFIX.toUpperCase(Locale.ROOT));
    }

    private static Optional<String> resolved(String tier, String phrase, String id) {
        logger.debug("许可证短语 '{}' 经 {} 规则匹配为 {}", phrase, tier, id);
        return Optional.of(id);
    }
}
