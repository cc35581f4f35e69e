package com.clausesplit.segment;

import com.clausesplit.tree.DependencyTree;

import java.util.ArrayList;
import java.util.List;

/**
 * 为每个词元选出包含它的最大候选跨度。
 *
 * 每个词元都作为根计算一次闭包，然后按根位置升序做一次反向索引扫描：
 * 只有严格更大的闭包才替换已有分配，因此同样大小时保留根位置最小者。
 * 结果等价于把词元分配给不越过子句边界就能支配它的最高中心词。
 */
public class SpanResolver {

    private final ClauseClosureComputer closureComputer;

    public SpanResolver(ClauseClosureComputer closureComputer) {
        this.closureComputer = closureComputer;
    }

    public SpanAssignment resolve(DependencyTree tree) {
        int size = tree.size();
        List<Closure> candidates = new ArrayList<>(size);
        for (int root = 0; root < size; root++) {
            candidates.add(closureComputer.closure(tree, root));
        }

        Closure[] assigned = new Closure[size];
        for (Closure candidate : candidates) {
            for (int position : candidate.positions()) {
                Closure current = assigned[position];
                if (current == null || candidate.size() > current.size()) {
                    assigned[position] = candidate;
                }
            }
        }
        return new SpanAssignment(candidates, assigned);
    }
}
