package com.clausesplit.config;

/**
 * 单个语言的切分规则与其对应的句法分析模型名称。
 */
public record LanguageProfile(
    String language,
    String parserModel,
    SegmenterConfig segmenter
) {

    public LanguageProfile {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language 不能为空");
        }
        if (segmenter == null) {
            segmenter = SegmenterConfig.defaults();
        }
    }
}
