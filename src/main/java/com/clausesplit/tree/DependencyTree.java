package com.clausesplit.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * 一个句子的依存树。
 *
 * 词元按位置存放在数组中，父子关系用按位置索引的子节点表表示，子节点按位置升序排列。
 * 构建时校验单根树约束，构建后不可变。
 */
public final class DependencyTree {

    private static final DependencyTree EMPTY = new DependencyTree(new DependencyToken[0], new int[0][], -1);

    private final DependencyToken[] tokens;
    private final int[][] children;
    private final int root;

    private DependencyTree(DependencyToken[] tokens, int[][] children, int root) {
        this.tokens = tokens;
        this.children = children;
        this.root = root;
    }

    public static DependencyTree empty() {
        return EMPTY;
    }

    /**
     * 由词元列表构建依存树，列表顺序无关，位置必须恰好覆盖 0..n-1。
     *
     * @throws MalformedTreeException 位置不连续、中心词越界、根节点数量不为一或存在环时抛出
     */
    public static DependencyTree of(List<DependencyToken> tokenList) {
        if (tokenList == null || tokenList.isEmpty()) {
            return EMPTY;
        }

        int size = tokenList.size();
        DependencyToken[] byPosition = new DependencyToken[size];
        for (DependencyToken token : tokenList) {
            int position = token.position();
            if (position < 0 || position >= size) {
                throw new MalformedTreeException("位置超出范围 0.." + (size - 1), position);
            }
            if (byPosition[position] != null) {
                throw new MalformedTreeException("位置重复", position);
            }
            byPosition[position] = token;
        }

        int root = -1;
        int[] childCounts = new int[size];
        for (DependencyToken token : byPosition) {
            if (token.isRoot()) {
                if (root >= 0) {
                    throw new MalformedTreeException("存在多个根节点: " + root + " 与 " + token.position(), token.position());
                }
                root = token.position();
                continue;
            }
            int head = token.head();
            if (head < 0 || head >= size) {
                throw new MalformedTreeException("中心词位置越界: " + head, token.position());
            }
            if (head == token.position()) {
                throw new MalformedTreeException("词元不能以自身为中心词", token.position());
            }
            childCounts[head]++;
        }
        if (root < 0) {
            throw new MalformedTreeException("缺少根节点");
        }

        int[][] children = new int[size][];
        int[] fill = new int[size];
        for (int position = 0; position < size; position++) {
            children[position] = new int[childCounts[position]];
        }
        for (DependencyToken token : byPosition) {
            if (!token.isRoot()) {
                int head = token.head();
                children[head][fill[head]++] = token.position();
            }
        }

        ensureConnected(children, root, size);
        return new DependencyTree(byPosition, children, root);
    }

    /**
     * 从根节点出发必须能到达所有词元，否则说明存在脱离根的环。
     */
    private static void ensureConnected(int[][] children, int root, int size) {
        boolean[] visited = new boolean[size];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        visited[root] = true;
        int reached = 1;
        while (!stack.isEmpty()) {
            int current = stack.pop();
            for (int child : children[current]) {
                if (!visited[child]) {
                    visited[child] = true;
                    reached++;
                    stack.push(child);
                }
            }
        }
        if (reached < size) {
            for (int position = 0; position < size; position++) {
                if (!visited[position]) {
                    throw new MalformedTreeException("依存关系存在环，词元无法从根节点到达", position);
                }
            }
        }
    }

    public int size() {
        return tokens.length;
    }

    public boolean isEmpty() {
        return tokens.length == 0;
    }

    public DependencyToken token(int position) {
        return tokens[position];
    }

    /**
     * 返回直接子节点位置（按位置升序）。
     */
    public int[] children(int position) {
        return children[position].clone();
    }

    public int childCount(int position) {
        return children[position].length;
    }

    /**
     * 第 index 个子节点的位置，遍历时避免复制子节点数组。
     */
    public int child(int position, int index) {
        return children[position][index];
    }

    /**
     * 根节点位置；空树返回 -1。
     */
    public int root() {
        return root;
    }

    public List<DependencyToken> tokens() {
        return List.of(tokens);
    }

    public List<String> texts() {
        List<String> texts = new ArrayList<>(tokens.length);
        for (DependencyToken token : tokens) {
            texts.add(token.text());
        }
        return texts;
    }

    @Override
    public String toString() {
        return "DependencyTree" + Arrays.toString(tokens);
    }
}
