package com.clausesplit.config;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 子句切分运行时配置
 *
 * 不可变，可从 JSON 反序列化；缺省字段回退到 Constants 中的默认值。
 * 依存关系与标签统一转为小写，比较时不区分大小写。
 */
public record SegmenterConfig(
    Set<String> boundaryRelations,
    Set<String> clauseHeadTags,
    List<String> boundaryTrimTokens,
    String defaultTerminator
) {

    public SegmenterConfig {
        boundaryRelations = lowerCased(boundaryRelations == null ? Constants.DEFAULT_BOUNDARY_RELATIONS : boundaryRelations);
        clauseHeadTags = lowerCased(clauseHeadTags == null ? Constants.DEFAULT_CLAUSE_HEAD_TAGS : clauseHeadTags);
        boundaryTrimTokens = List.copyOf(boundaryTrimTokens == null ? Constants.ENGLISH_TRIM_TOKENS : boundaryTrimTokens);
        if (defaultTerminator == null || defaultTerminator.isBlank()) {
            defaultTerminator = Constants.DEFAULT_TERMINATOR;
        }
    }

    /**
     * 使用默认（英文）规则创建实例
     */
    public static SegmenterConfig defaults() {
        return new SegmenterConfig(null, null, null, null);
    }

    public SegmenterConfig withBoundaryRelations(Set<String> relations) {
        return new SegmenterConfig(relations, clauseHeadTags, boundaryTrimTokens, defaultTerminator);
    }

    public SegmenterConfig withClauseHeadTags(Set<String> tags) {
        return new SegmenterConfig(boundaryRelations, tags, boundaryTrimTokens, defaultTerminator);
    }

    public SegmenterConfig withBoundaryTrimTokens(List<String> trimTokens) {
        return new SegmenterConfig(boundaryRelations, clauseHeadTags, trimTokens, defaultTerminator);
    }

    public SegmenterConfig withDefaultTerminator(String terminator) {
        return new SegmenterConfig(boundaryRelations, clauseHeadTags, boundaryTrimTokens, terminator);
    }

    /**
     * 判断依存边是否构成子句边界：关系与子节点标签须同时命中。
     */
    public boolean isBoundary(String depLabel, String tag) {
        return boundaryRelations.contains(lower(depLabel)) && clauseHeadTags.contains(lower(tag));
    }

    private static Set<String> lowerCased(Set<String> values) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String value : values) {
            normalized.add(lower(value));
        }
        return Set.copyOf(normalized);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
