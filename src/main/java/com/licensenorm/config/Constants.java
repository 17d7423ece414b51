package com.licensenorm.config;

import java.util.Set;

/**
 * 全局常量定义
 * 
 * 包含资源路径、保留字、引用前缀与输入长度限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 资源路径 ====================
    /** SPDX 许可证与例外词表 */
    public static final String VOCABULARY_RESOURCE = "/spdx/vocabulary.json";
    /** 许可证分类表 */
    public static final String CATEGORIES_RESOURCE = "/spdx/categories.json";

    // ==================== 保留字 ====================
    /** 未附带许可证 */
    public static final String NONE = "NONE";
    /** 未声明许可证 */
    public static final String NOASSERTION = "NOASSERTION";
    /** 特殊值集合（大写） */
    public static final Set<String> SPECIAL_VALUES = Set.of(NONE, NOASSERTION);
    /** 运算符关键字（大写） */
    public static final Set<String> OPERATORS = Set.of("AND", "OR", "WITH");

    // ==================== 引用前缀 ====================
    /** 自定义许可证引用前缀 */
    public static final String LICENSE_REF_PREFIX = "LicenseRef-";
    /** 外部文档引用前缀 */
    public static final String DOCUMENT_REF_PREFIX = "DocumentRef-";
    /** 文档引用与许可证引用之间的分隔符 */
    public static final String DOCUMENT_REF_SEPARATOR = ":LicenseRef-";

    // ==================== 输入限制 ====================
    /** 单个表达式最大字符数 */
    public static final int MAX_EXPRESSION_LENGTH = 4096;
    /** 括号最大嵌套层数 */
    public static final int MAX_NESTING_DEPTH = 256;
}
