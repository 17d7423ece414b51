package com.licensenorm.category;

/**
 * 许可证分类
 */
public enum LicenseCategory {
    PERMISSIVE("Permissive"),
    COPYLEFT("Copyleft"),
    COPYLEFT_LIMITED("Copyleft Limited"),
    COMMERCIAL("Commercial"),
    PROPRIETARY_FREE("Proprietary Free"),
    PUBLIC_DOMAIN("Public Domain"),
    PATENT_LICENSE("Patent License"),
    SOURCE_AVAILABLE("Source-available"),
    FREE_RESTRICTED("Free Restricted"),
    CLA("CLA"),
    UNSTATED("Unstated License"),
    UNKNOWN("Unknown");

    private final String label;

    LicenseCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 按分类表中的名称查找，空值或未知名称返回 UNKNOWN。
     */
    public static LicenseCategory fromLabel(String label) {
        if (label == null || label.isEmpty()) {
            return UNKNOWN;
        }
        for (LicenseCategory category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        return UNKNOWN;
    }

    public boolean isPermissive() {
        return this == PERMISSIVE || this == PUBLIC_DOMAIN;
    }

    public boolean isCopyleft() {
        return this == COPYLEFT || this == COPYLEFT_LIMITED;
    }

    public boolean isCommercial() {
        return this == COMMERCIAL || this == PROPRIETARY_FREE;
    }

    @Override
    public String toString() {
        return label;
    }
}
