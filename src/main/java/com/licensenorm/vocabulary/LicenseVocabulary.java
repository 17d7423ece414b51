package com.licensenorm.vocabulary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensenorm.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * SPDX 许可证与例外标识符词表
 * 
 * 查找不区分大小写，命中时返回规范拼写。废弃标识符与现行许可证共用同一查找表，
 * 例外标识符单独成表。实例构造后只读，可被任意线程共享。
 */
public final class LicenseVocabulary {
    private static final Logger logger = LoggerFactory.getLogger(LicenseVocabulary.class);

    private final String licenseListVersion;
    private final Map<String, String> licenses;
    private final Map<String, String> deprecated;
    private final Map<String, String> exceptions;

    private LicenseVocabulary(String licenseListVersion, Collection<String> licenseIds,
                              Collection<String> deprecatedIds, Collection<String> exceptionIds) {
        this.licenseListVersion = licenseListVersion == null ? "unknown" : licenseListVersion;
        Map<String, String> licenseTable = new HashMap<>();
        Map<String, String> deprecatedTable = new HashMap<>();
        Map<String, String> exceptionTable = new HashMap<>();
        index(licenseTable, licenseIds);
        index(deprecatedTable, deprecatedIds);
        index(licenseTable, deprecatedIds);
        index(exceptionTable, exceptionIds);
        this.licenses = Collections.unmodifiableMap(licenseTable);
        this.deprecated = Collections.unmodifiableMap(deprecatedTable);
        this.exceptions = Collections.unmodifiableMap(exceptionTable);
    }

    /**
     * 返回进程级默认词表，首次访问时从类路径加载。
     */
    public static LicenseVocabulary defaultVocabulary() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * 由显式标识符集合构造词表，主要用于测试与嵌入场景。
     */
    public static LicenseVocabulary of(Collection<String> licenseIds, Collection<String> deprecatedIds,
                                       Collection<String> exceptionIds) {
        return new LicenseVocabulary(null, licenseIds, deprecatedIds, exceptionIds);
    }

    /**
     * 从类路径 JSON 资源加载词表。
     *
     * @throws IllegalStateException 资源缺失或格式错误
     */
    public static LicenseVocabulary load(String resource) {
        try (InputStream input = LicenseVocabulary.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException("找不到许可证词表资源: " + resource);
            }
            VocabularyData data = new ObjectMapper().readValue(input, VocabularyData.class);
            LicenseVocabulary vocabulary = new LicenseVocabulary(data.licenseListVersion(),
                    nullToEmpty(data.licenses()), nullToEmpty(data.deprecated()), nullToEmpty(data.exceptions()));
            logger.info("已加载许可证词表 {} (版本 {}): {} 个许可证, {} 个废弃标识符, {} 个例外",
                    resource, vocabulary.licenseListVersion, vocabulary.licenses.size() - vocabulary.deprecated.size(),
                    vocabulary.deprecated.size(), vocabulary.exceptions.size());
            return vocabulary;
        } catch (IOException exception) {
            throw new IllegalStateException("无法读取许可证词表: " + resource, exception);
        }
    }

    /**
     * 不区分大小写查找许可证（含废弃标识符），返回规范拼写。
     */
    public Optional<String> lookupLicense(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(licenses.get(id.toLowerCase(Locale.ROOT)));
    }

    /**
     * 不区分大小写查找许可证例外，返回规范拼写。
     */
    public Optional<String> lookupException(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(exceptions.get(id.toLowerCase(Locale.ROOT)));
    }

    public boolean isLicense(String id) {
        return lookupLicense(id).isPresent();
    }

    public boolean isException(String id) {
        return lookupException(id).isPresent();
    }

    public boolean isDeprecated(String id) {
        return id != null && deprecated.containsKey(id.toLowerCase(Locale.ROOT));
    }

    public String getLicenseListVersion() {
        return licenseListVersion;
    }

    /** 许可证总数（含废弃标识符） */
    public int licenseCount() {
        return licenses.size();
    }

    public int exceptionCount() {
        return exceptions.size();
    }

    private static void index(Map<String, String> table, Collection<String> ids) {
        for (String id : ids) {
            table.put(id.toLowerCase(Locale.ROOT), id);
        }
    }

    private static List<String> nullToEmpty(List<String> ids) {
        return ids == null ? List.of() : ids;
    }

    private static final class DefaultHolder {
        private static final LicenseVocabulary INSTANCE = load(Constants.VOCABULARY_RESOURCE);
    }
}
