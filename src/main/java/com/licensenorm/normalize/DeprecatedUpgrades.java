package com.licensenorm.normalize;

import java.util.Set;

/**
 * 将废弃的 GNU 系列标识符升级为带 -only / -or-later 后缀的现行形式。
 */
public final class DeprecatedUpgrades {

    /** 升级为 -only 的标识符 */
    static final Set<String> ONLY = Set.of(
        "GPL-1.0", "GPL-2.0", "LGPL-1.0", "LGPL-2.0", "LGPL-2.1", "AGPL-1.0", "AGPL-2.0"
    );

    /** 升级为 -or-later 的标识符 */
    static final Set<String> OR_LATER = Set.of(
        "GPL-3.0", "LGPL-3.0", "AGPL-3.0"
    );

    private DeprecatedUpgrades() {
    }

    /**
     * 升级废弃标识符；带 "+" 的形式一律升级为 -or-later，其余标识符原样返回。
     */
    public static String upgrade(String id) {
        if (id == null) {
            return null;
        }
        if (id.endsWith("+")) {
            String base = id.substring(0, id.length() - 1);
            if (ONLY.contains(base) || OR_LATER.contains(base)) {
                return base + "-or-later";
            }
            return id;
        }
        if (ONLY.contains(id)) {
            return id + "-only";
        }
        if (OR_LATER.contains(id)) {
            return id + "-or-later";
        }
        return id;
    }
}
