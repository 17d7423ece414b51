package com.licensenorm.expression;

import com.licensenorm.config.Constants;

/**
 * 将语法树渲染为规范文本，只在优先级需要时加括号。
 */
public final class ExpressionRenderer {

    private ExpressionRenderer() {
    }

    public static String render(Expression expression) {
        StringBuilder builder = new StringBuilder();
        append(expression, builder);
        return builder.toString();
    }

    private static void append(Expression node, StringBuilder out) {
        if (node instanceof Expression.License license) {
            out.append(license.id());
            if (license.orLater()) {
                out.append('+');
            }
            if (license.hasException()) {
                out.append(" WITH ").append(license.exception());
            }
        } else if (node instanceof Expression.LicenseRef ref) {
            if (ref.documentRef() != null) {
                out.append(Constants.DOCUMENT_REF_PREFIX).append(ref.documentRef())
                        .append(Constants.DOCUMENT_REF_SEPARATOR);
            } else {
                out.append(Constants.LICENSE_REF_PREFIX);
            }
            out.append(ref.licenseRef());
        } else if (node instanceof Expression.AndExpression and) {
            appendOperand(and.left(), and.left() instanceof Expression.OrExpression, out);
            out.append(" AND ");
            appendOperand(and.right(), and.right() instanceof Expression.OrExpression, out);
        } else if (node instanceof Expression.OrExpression or) {
            appendOperand(or.left(), needsParenthesesUnderOr(or.left()), out);
            out.append(" OR ");
            appendOperand(or.right(), needsParenthesesUnderOr(or.right()), out);
        } else if (node instanceof Expression.SpecialValue special) {
            out.append(special.value());
        }
    }

    private static boolean needsParenthesesUnderOr(Expression child) {
        return child instanceof Expression.AndExpression
                || (child instanceof Expression.License license && license.hasException());
    }

    private static void appendOperand(Expression child, boolean parenthesize, StringBuilder out) {
        if (parenthesize) {
            out.append('(');
            append(child, out);
            out.append(')');
        } else {
            append(child, out);
        }
    }
}
