package com.licensenorm.vocabulary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 词表资源文件的 JSON 结构。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record VocabularyData(String licenseListVersion, List<String> licenses, List<String> deprecated,
                      List<String> exceptions) {
}
