package com.clausesplit.segment;

import com.clausesplit.config.SegmenterConfig;
import com.clausesplit.tree.DependencyToken;
import com.clausesplit.tree.DependencyTree;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * 计算以给定词元为根的子句闭包。
 *
 * 沿子节点向下展开；若子节点的依存关系属于边界关系且其标签是子句中心词标签，
 * 则整棵子树被剪掉，不再下探。深层子节点各自独立判断。
 */
public class ClauseClosureComputer {

    private final SegmenterConfig config;

    public ClauseClosureComputer(SegmenterConfig config) {
        this.config = config;
    }

    /**
     * 以显式栈做深度优先遍历，避免长句递归过深。
     */
    public Closure closure(DependencyTree tree, int root) {
        if (root < 0 || root >= tree.size()) {
            throw new IndexOutOfBoundsException("root " + root + " 超出句长 " + tree.size());
        }

        BitSet members = new BitSet(tree.size());
        members.set(root);
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            int current = stack.pop();
            int childCount = tree.childCount(current);
            for (int index = 0; index < childCount; index++) {
                int child = tree.child(current, index);
                if (isBoundary(tree.token(child))) {
                    continue;
                }
                members.set(child);
                stack.push(child);
            }
        }
        return new Closure(root, members);
    }

    /**
     * 判断子节点是否开启新子句。
     */
    public boolean isBoundary(DependencyToken child) {
        return config.isBoundary(child.depLabel(), child.tag());
    }
}
