package com.licensenorm.config;

/**
 * 规范化器运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class NormalizerConfig {
    private String vocabularyResource = Constants.VOCABULARY_RESOURCE;
    private String categoriesResource = Constants.CATEGORIES_RESOURCE;
    private int maxExpressionLength = Constants.MAX_EXPRESSION_LENGTH;
    private boolean laxByDefault = true;

    public String getVocabularyResource() {
        return vocabularyResource;
    }

    public void setVocabularyResource(String vocabularyResource) {
        this.vocabularyResource = vocabularyResource;
    }

    public String getCategoriesResource() {
        return categoriesResource;
    }

    public void setCategoriesResource(String categoriesResource) {
        this.categoriesResource = categoriesResource;
    }

    public int getMaxExpressionLength() {
        return maxExpressionLength;
    }

    public void setMaxExpressionLength(int maxExpressionLength) {
        this.maxExpressionLength = maxExpressionLength;
    }

    public boolean isLaxByDefault() {
        return laxByDefault;
    }

    public void setLaxByDefault(boolean laxByDefault) {
        this.laxByDefault = laxByDefault;
    }

    /**
     * 创建默认配置
     */
    public static NormalizerConfig defaults() {
        return new NormalizerConfig();
    }
}
