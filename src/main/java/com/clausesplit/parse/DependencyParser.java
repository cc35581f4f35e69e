package com.clausesplit.parse;

import com.clausesplit.tree.DependencyTree;

/**
 * 外部依存句法分析器的接入契约。
 *
 * 输入为已归一化（小写、标点已分隔）的单句文本，输出单根依存树。
 * 模型加载与分析失败由实现方负责处理。
 */
@FunctionalInterface
public interface DependencyParser {

    DependencyTree parse(String normalizedText);
}
