package com.licensenorm;

/**
 * 表达式解析与规范化失败的类别。
 */
public enum ErrorKind {
    EMPTY_INPUT("表达式为空"),
    UNEXPECTED_TOKEN("意外token"),
    UNBALANCED_PARENTHESES("括号不匹配"),
    INVALID_LICENSE_IDENTIFIER("无效的许可证标识符"),
    INVALID_EXCEPTION_IDENTIFIER("无效的例外标识符"),
    MISSING_OPERAND("缺少操作数"),
    INVALID_SPECIAL_VALUE_PLACEMENT("NONE/NOASSERTION 只能作为完整表达式出现");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
