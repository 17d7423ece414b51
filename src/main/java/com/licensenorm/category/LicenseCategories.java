package com.licensenorm.category;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensenorm.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 许可证分类表
 * 
 * 以 SPDX 标识符、其他 SPDX 别名与 scancode 键（均小写）为索引。
 * 资源无法读取时退化为空表，所有许可证归为 Unknown。
 */
public final class LicenseCategories {
    private static final Logger logger = LoggerFactory.getLogger(LicenseCategories.class);
    private static final String SCANCODE_REF_PREFIX = "LicenseRef-";

    private final Map<String, LicenseInfo> byKey;

    private LicenseCategories(List<LicenseInfo> records) {
        Map<String, LicenseInfo> table = new HashMap<>(records.size() * 2);
        for (LicenseInfo info : records) {
            if (info.spdxLicenseKey() != null && !info.spdxLicenseKey().isEmpty()) {
                table.put(info.spdxLicenseKey().toLowerCase(Locale.ROOT), info);
            }
            for (String key : info.otherSpdxLicenseKeys()) {
                if (!key.startsWith(SCANCODE_REF_PREFIX)) {
                    table.put(key.toLowerCase(Locale.ROOT), info);
                }
            }
            if (info.licenseKey() != null) {
                table.put(info.licenseKey().toLowerCase(Locale.ROOT), info);
            }
        }
        this.byKey = Collections.unmodifiableMap(table);
    }

    public static LicenseCategories defaultCategories() {
        return DefaultHolder.INSTANCE;
    }

    public static LicenseCategories of(List<LicenseInfo> records) {
        return new LicenseCategories(records);
    }

    /**
     * 从类路径加载分类表；失败时记录警告并返回空表。
     */
    public static LicenseCategories load(String resource) {
        try (InputStream input = LicenseCategories.class.getResourceAsStream(resource)) {
            if (input == null) {
                logger.warn("找不到许可证分类资源: {}，全部许可证将归为 Unknown", resource);
                return new LicenseCategories(List.of());
            }
            List<LicenseInfo> records = new ObjectMapper().readValue(input, new TypeReference<List<LicenseInfo>>() {
            });
            logger.info("已加载许可证分类表 {}: {} 条记录", resource, records.size());
            return new LicenseCategories(records);
        } catch (IOException exception) {
            logger.warn("无法读取许可证分类表: {} - {}", resource, exception.getMessage());
            return new LicenseCategories(List.of());
        }
    }

    /**
     * 查询分类：先精确匹配，再去掉 -only / -or-later 后缀匹配，否则为 UNKNOWN。
     */
    public LicenseCategory categoryOf(String license) {
        return licenseInfo(license)
                .map(LicenseInfo::licenseCategory)
                .orElse(LicenseCategory.UNKNOWN);
    }

    public Optional<LicenseInfo> licenseInfo(String license) {
        if (license == null || license.isEmpty()) {
            return Optional.empty();
        }
        LicenseInfo info = byKey.get(license.toLowerCase(Locale.ROOT));
        if (info != null) {
            return Optional.of(info);
        }
        String stripped = stripSuffix(stripSuffix(license, "-only"), "-or-later");
        return Optional.ofNullable(byKey.get(stripped.toLowerCase(Locale.ROOT)));
    }

    public boolean isPermissive(String license) {
        return categoryOf(license).isPermissive();
    }

    public boolean isCopyleft(String license) {
        return categoryOf(license).isCopyleft();
    }

    public boolean isCommercial(String license) {
        return categoryOf(license).isCommercial();
    }

    public int size() {
        return byKey.size();
    }

    private static String stripSuffix(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }

    private static final class DefaultHolder {
        private static final LicenseCategories INSTANCE = load(Constants.CATEGORIES_RESOURCE);
    }
}
