package com.clausesplit.segment;

import java.util.List;
import java.util.Set;

/**
 * 裁剪子句首尾悬空的连词与标点。
 *
 * 每一轮先检查首词再检查末词，直到某一轮没有删除任何词或只剩一个词；结果不会为空。
 */
public class BoundaryTrimmer {

    private final Set<String> trimTokens;

    public BoundaryTrimmer(List<String> trimTokens) {
        this.trimTokens = Set.copyOf(trimTokens);
    }

    public List<String> trim(List<String> tokens) {
        if (tokens.size() <= 1) {
            return List.copyOf(tokens);
        }

        int start = 0;
        int end = tokens.size();
        while (true) {
            boolean removed = false;
            if (trimTokens.contains(tokens.get(start))) {
                start++;
                removed = true;
            }
            if (end - start > 1 && trimTokens.contains(tokens.get(end - 1))) {
                end--;
                removed = true;
            }
            if (!removed || end - start <= 1) {
                break;
            }
        }
        return List.copyOf(tokens.subList(start, end));
    }
}
