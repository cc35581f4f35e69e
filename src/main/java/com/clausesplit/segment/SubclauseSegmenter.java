package com.clausesplit.segment;

import com.clausesplit.config.SegmenterConfig;
import com.clausesplit.tree.DependencyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 子句切分入口：依存树 → 有序子句列表。
 *
 * 实例不可变，可在多线程间共享。
 */
public class SubclauseSegmenter {
    private static final Logger logger = LoggerFactory.getLogger(SubclauseSegmenter.class);

    private final SegmenterConfig config;
    private final SpanResolver spanResolver;
    private final SubclauseAssembler assembler;

    /**
     * 使用默认（英文）规则构造。
     */
    public SubclauseSegmenter() {
        this(SegmenterConfig.defaults());
    }

    public SubclauseSegmenter(SegmenterConfig config) {
        this.config = config;
        this.spanResolver = new SpanResolver(new ClauseClosureComputer(config));
        this.assembler = new SubclauseAssembler(config);
    }

    /**
     * 切分单句；空树返回空列表。
     */
    public List<Subclause> segment(DependencyTree tree) {
        if (tree == null || tree.isEmpty()) {
            return List.of();
        }

        long startNanos = System.nanoTime();
        String sentenceFinal = Terminators.sentenceFinal(tree.texts(), config.defaultTerminator());
        SpanAssignment assignment = spanResolver.resolve(tree);
        List<Subclause> subclauses = assembler.assemble(assignment, tree, sentenceFinal);

        if (logger.isDebugEnabled()) {
            logger.debug("句长 {} 切分为 {} 个子句，用时 {}µs",
                tree.size(), subclauses.size(), (System.nanoTime() - startNanos) / 1_000);
        }
        return subclauses;
    }

    public SegmenterConfig getConfig() {
        return config;
    }
}
