package com.licensenorm.category;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 分类表中的一条许可证记录。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LicenseInfo(
        @JsonProperty("license_key") String licenseKey,
        @JsonProperty("category") String category,
        @JsonProperty("spdx_license_key") String spdxLicenseKey,
        @JsonProperty("other_spdx_license_keys") List<String> otherSpdxLicenseKeys,
        @JsonProperty("is_exception") boolean exception,
        @JsonProperty("is_deprecated") boolean deprecated) {

    public LicenseInfo {
        otherSpdxLicenseKeys = otherSpdxLicenseKeys == null ? List.of() : List.copyOf(otherSpdxLicenseKeys);
    }

    public LicenseCategory licenseCategory() {
        return LicenseCategory.fromLabel(category);
    }
}
