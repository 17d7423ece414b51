package com.licensenorm;

import java.util.List;

/**
 * 批量校验结果，invalid 保持输入顺序。
 */
public record LicenseValidation(boolean valid, List<String> invalid) {
    public LicenseValidation {
        invalid = List.copyOf(invalid);
    }
}
