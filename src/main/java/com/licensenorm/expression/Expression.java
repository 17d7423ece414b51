package com.licensenorm.expression;

import com.licensenorm.config.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SPDX 许可证表达式语法树。由一次解析创建，创建后不可变。
 */
public sealed interface Expression permits Expression.License, Expression.LicenseRef,
        Expression.AndExpression, Expression.OrExpression, Expression.SpecialValue {

    /**
     * 按出现顺序返回叶子许可证（不去重）。License 不含 "+" 与例外，LicenseRef 返回完整引用文本。
     */
    default List<String> licenses() {
        List<String> collected = new ArrayList<>();
        collectLicenses(this, collected);
        return List.copyOf(collected);
    }

    private static void collectLicenses(Expression node, List<String> out) {
        if (node instanceof License license) {
            out.add(license.id());
        } else if (node instanceof LicenseRef ref) {
            out.add(ref.toString());
        } else if (node instanceof AndExpression and) {
            collectLicenses(and.left(), out);
            collectLicenses(and.right(), out);
        } else if (node instanceof OrExpression or) {
            collectLicenses(or.left(), out);
            collectLicenses(or.right(), out);
        }
    }

    /**
     * 单个许可证，标识符由解析器校验后传入。exception 为空表示未附带例外。
     */
    record License(String id, boolean orLater, String exception) implements Expression {
        public License {
            Objects.requireNonNull(id, "id");
        }

        public License(String id, boolean orLater) {
            this(id, orLater, null);
        }

        public boolean hasException() {
            return exception != null;
        }

        public License withException(String exceptionId) {
            return new License(id, orLater, exceptionId);
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    /**
     * 自定义许可证引用，documentRef 为空表示无外部文档前缀。
     */
    record LicenseRef(String documentRef, String licenseRef) implements Expression {
        public LicenseRef {
            Objects.requireNonNull(licenseRef, "licenseRef");
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    record AndExpression(Expression left, Expression right) implements Expression {
        public AndExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    record OrExpression(Expression left, Expression right) implements Expression {
        public OrExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    /**
     * NONE 或 NOASSERTION，只能作为完整表达式出现。
     */
    record SpecialValue(String value) implements Expression {
        public static final SpecialValue NONE = new SpecialValue(Constants.NONE);
        public static final SpecialValue NOASSERTION = new SpecialValue(Constants.NOASSERTION);

        public SpecialValue {
            if (value == null || !Constants.SPECIAL_VALUES.contains(value)) {
                throw new IllegalArgumentException("非法特殊值: " + value);
            }
        }

        /**
         * 不区分大小写识别特殊值，非特殊值返回 null。
         */
        public static SpecialValue parse(String word) {
            if (word == null) {
                return null;
            }
            String upper = word.toUpperCase(Locale.ROOT);
            return Constants.SPECIAL_VALUES.contains(upper) ? new SpecialValue(upper) : null;
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
