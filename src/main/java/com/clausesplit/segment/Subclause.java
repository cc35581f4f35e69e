package com.clausesplit.segment;

import java.util.List;

/**
 * 切分结果中的一个子句：按原句顺序排列的表层词元。
 */
public record Subclause(List<String> tokens) {

    public Subclause {
        tokens = List.copyOf(tokens);
    }

    /**
     * 以单个空格连接词元。
     */
    public String text() {
        return String.join(" ", tokens);
    }

    public String lastToken() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }
}
