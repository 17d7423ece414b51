package com.licensenorm;

import com.licensenorm.category.LicenseCategories;
import com.licensenorm.category.LicenseCategory;
import com.licensenorm.config.Constants;
import com.licensenorm.config.NormalizerConfig;
import com.licensenorm.expression.Expression;
import com.licensenorm.expression.LicenseSatisfaction;
import com.licensenorm.normalize.LicenseNormalizer;
import com.licensenorm.parse.ExpressionParser;
import com.licensenorm.parse.ExpressionPreprocessor;
import com.licensenorm.vocabulary.LicenseVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 许可证表达式入口
 * 
 * 组合词表、规范化器、解析器与分类表。实例只读，可跨线程共享；
 * 每次调用创建独立的解析器。
 */
public class LicenseExpressions {
    private static final Logger logger = LoggerFactory.getLogger(LicenseExpressions.class);

    private final NormalizerConfig config;
    private final LicenseVocabulary vocabulary;
    private final LicenseNormalizer normalizer;
    private final LicenseCategories categories;

    public LicenseExpressions(LicenseVocabulary vocabulary, LicenseCategories categories) {
        this(NormalizerConfig.defaults(), vocabulary, categories);
    }

    private LicenseExpressions(NormalizerConfig config, LicenseVocabulary vocabulary, LicenseCategories categories) {
        this.config = config;
        this.vocabulary = vocabulary;
        this.normalizer = new LicenseNormalizer(vocabulary);
        this.categories = categories;
    }

    /**
     * 使用默认词表与分类表。
     */
    public static LicenseExpressions defaults() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * 按配置加载资源；资源路径与默认值相同时复用进程级实例。
     */
    public static LicenseExpressions create(NormalizerConfig config) {
        LicenseVocabulary vocabulary = Constants.VOCABULARY_RESOURCE.equals(config.getVocabularyResource())
                ? LicenseVocabulary.defaultVocabulary()
                : LicenseVocabulary.load(config.getVocabularyResource());
        LicenseCategories categories = Constants.CATEGORIES_RESOURCE.equals(config.getCategoriesResource())
                ? LicenseCategories.defaultCategories()
                : LicenseCategories.load(config.getCategoriesResource());
        return new LicenseExpressions(config, vocabulary, categories);
    }

    /**
     * 宽松解析：先把非正式名称规范化，再严格解析。
     * 严格解析阶段的错误位置会映射回原始输入。
     */
    public Expression parse(String text) {
        ExpressionPreprocessor preprocessor = new ExpressionPreprocessor(normalizer);
        String normalized = preprocessor.preprocess(text);
        logger.debug("表达式 '{}' 预处理为 '{}'", text, normalized);
        try {
            return parseStrict(normalized);
        } catch (LicenseExpressionException exception) {
            if (exception.getPosition() < 0) {
                throw exception;
            }
            throw new LicenseExpressionException(exception.getKind(), exception.getOffendingText(),
                    preprocessor.originalPosition(exception.getPosition()), text);
        }
    }

    /**
     * 严格解析：只接受词表中的标识符。
     */
    public Expression parseStrict(String text) {
        return new ExpressionParser(vocabulary).parse(text);
    }

    /**
     * 按配置的默认模式解析。
     */
    public Expression parseDefault(String text) {
        return config.isLaxByDefault() ? parse(text) : parseStrict(text);
    }

    public String normalize(String license) {
        return normalizer.normalize(license);
    }

    public String normalizeExpression(String text) {
        return parse(text).toString();
    }

    public boolean valid(String text) {
        try {
            parseStrict(text);
            return true;
        } catch (LicenseExpressionException exception) {
            logger.debug("表达式无效: {}", exception.getMessage());
            return false;
        }
    }

    public boolean validLicense(String id) {
        return vocabulary.isLicense(id);
    }

    /**
     * 严格解析后返回去重并排序的许可证列表。
     */
    public List<String> extractLicenses(String text) {
        return new ArrayList<>(new TreeSet<>(parseStrict(text).licenses()));
    }

    public LicenseValidation validateLicenses(List<String> ids) {
        List<String> invalid = new ArrayList<>();
        for (String id : ids) {
            if (!valid(id)) {
                invalid.add(id);
            }
        }
        return new LicenseValidation(invalid.isEmpty(), invalid);
    }

    /**
     * 判断表达式能否被 allowed 中的许可证满足；allowed 每项必须是单个许可证。
     *
     * @throws LicenseExpressionException 表达式或 allowed 中某项无效
     */
    public boolean satisfies(String text, List<String> allowed) {
        Expression expression = parseStrict(text);
        List<Expression> allowedTerms = new ArrayList<>(allowed.size());
        for (String entry : allowed) {
            Expression term = parseStrict(entry);
            if (!(term instanceof Expression.License) && !(term instanceof Expression.LicenseRef)) {
                throw new LicenseExpressionException(ErrorKind.UNEXPECTED_TOKEN, entry);
            }
            allowedTerms.add(term);
        }
        return LicenseSatisfaction.satisfies(expression, allowedTerms);
    }

    public LicenseCategory categoryOf(String license) {
        return categories.categoryOf(license);
    }

    /**
     * 按首次出现顺序返回表达式涉及的分类（去重）。
     */
    public List<LicenseCategory> expressionCategories(String text) {
        Set<LicenseCategory> seen = new LinkedHashSet<>();
        for (String license : extractLicenses(text)) {
            seen.add(categories.categoryOf(license));
        }
        return List.copyOf(seen);
    }

    public boolean hasCopyleft(String text) {
        try {
            return extractLicenses(text).stream().anyMatch(categories::isCopyleft);
        } catch (LicenseExpressionException exception) {
            logger.debug("无法分类表达式: {}", exception.getMessage());
            return false;
        }
    }

    public boolean isFullyPermissive(String text) {
        try {
            List<String> licenses = extractLicenses(text);
            return !licenses.isEmpty() && licenses.stream().allMatch(categories::isPermissive);
        } catch (LicenseExpressionException exception) {
            logger.debug("无法分类表达式: {}", exception.getMessage());
            return false;
        }
    }

    public NormalizerConfig getConfig() {
        return config;
    }

    public LicenseVocabulary getVocabulary() {
        return vocabulary;
    }

    public LicenseCategories getCategories() {
        return categories;
    }

    private static final class DefaultHolder {
        private static final LicenseExpressions INSTANCE = create(NormalizerConfig.defaults());
    }
}
