package com.licensenorm.expression;

import java.util.List;
import java.util.Objects;

/**
 * 判断表达式能否只用给定的许可证集合满足。
 */
public final class LicenseSatisfaction {

    private LicenseSatisfaction() {
    }

    /**
     * AND 需要两侧都满足，OR 只需一侧；NONE / NOASSERTION 永远不满足。
     */
    public static boolean satisfies(Expression expression, List<Expression> allowed) {
        if (expression instanceof Expression.License license) {
            return allowed.stream().anyMatch(candidate -> matches(license, candidate));
        }
        if (expression instanceof Expression.LicenseRef ref) {
            String rendered = ref.toString();
            return allowed.stream().anyMatch(candidate -> rendered.equals(candidate.toString()));
        }
        if (expression instanceof Expression.AndExpression and) {
            return satisfies(and.left(), allowed) && satisfies(and.right(), allowed);
        }
        if (expression instanceof Expression.OrExpression or) {
            return satisfies(or.left(), allowed) || satisfies(or.right(), allowed);
        }
        return false;
    }

    private static boolean matches(Expression.License license, Expression candidate) {
        if (!(candidate instanceof Expression.License allowedLicense)) {
            return false;
        }
        return license.id().equalsIgnoreCase(allowedLicense.id())
                && license.orLater() == allowedLicense.orLater()
                && Objects.equals(license.exception(), allowedLicense.exception());
    }
}
