package com.clausesplit.tree;

/**
 * 句法分析器输出的单个词元。
 *
 * position 为句内从 0 开始的原始顺序，head 为中心词位置，句子根节点的 head 为 {@link #NO_HEAD}。
 */
public record DependencyToken(
    int position,
    String text,
    String tag,
    String depLabel,
    int head
) {

    public static final int NO_HEAD = -1;

    public DependencyToken {
        text = text == null ? "" : text;
        tag = tag == null ? "" : tag;
        depLabel = depLabel == null ? "" : depLabel;
    }

    public boolean isRoot() {
        return head == NO_HEAD;
    }
}
