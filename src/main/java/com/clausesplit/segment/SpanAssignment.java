package com.clausesplit.segment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 每个词元位置被分配到的子句跨度。
 */
public final class SpanAssignment {
    private final List<Closure> candidates;
    private final Closure[] assigned;

    SpanAssignment(List<Closure> candidates, Closure[] assigned) {
        this.candidates = List.copyOf(candidates);
        this.assigned = assigned.clone();
    }

    public int size() {
        return assigned.length;
    }

    public Closure assigned(int position) {
        return assigned[position];
    }

    /**
     * 按根位置排列的全部候选闭包。
     */
    public List<Closure> candidates() {
        return candidates;
    }

    /**
     * 位置到所分配跨度的映射，按位置升序迭代。
     */
    public Map<Integer, Closure> asMap() {
        Map<Integer, Closure> mapping = new LinkedHashMap<>();
        for (int position = 0; position < assigned.length; position++) {
            mapping.put(position, assigned[position]);
        }
        return Collections.unmodifiableMap(mapping);
    }
}
