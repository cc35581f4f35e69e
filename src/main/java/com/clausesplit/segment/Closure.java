package com.clausesplit.segment;

import java.util.BitSet;

/**
 * 以某个词元为根的候选子句跨度：从根出发、不越过子句边界可达的位置集合。
 *
 * 集合非空且总包含根位置。相等性只比较位置集合，不比较根。
 */
public final class Closure {
    private final int root;
    private final BitSet positions;
    private final int size;

    Closure(int root, BitSet positions) {
        this.root = root;
        this.positions = (BitSet) positions.clone();
        this.size = this.positions.cardinality();
    }

    public int root() {
        return root;
    }

    public int size() {
        return size;
    }

    public boolean contains(int position) {
        return position >= 0 && positions.get(position);
    }

    public int firstPosition() {
        return positions.nextSetBit(0);
    }

    /**
     * 按位置升序返回成员。
     */
    public int[] positions() {
        return positions.stream().toArray();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Closure closure)) {
            return false;
        }
        return positions.equals(closure.positions);
    }

    @Override
    public int hashCode() {
        return positions.hashCode();
    }

    @Override
    public String toString() {
        return "Closure{root=" + root + ", positions=" + positions + "}";
    }
}
