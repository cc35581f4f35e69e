package com.clausesplit.segment;

import com.clausesplit.config.SegmenterConfig;
import com.clausesplit.tree.DependencyTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 将分配结果组装为有序子句列表。
 */
public class SubclauseAssembler {

    private final BoundaryTrimmer trimmer;

    public SubclauseAssembler(SegmenterConfig config) {
        this.trimmer = new BoundaryTrimmer(config.boundaryTrimTokens());
    }

    /**
     * 去重跨度并按首词位置排序，恢复终止符、裁剪首尾边界词后以整句终止符封口。
     */
    public List<Subclause> assemble(SpanAssignment assignment, DependencyTree tree, String sentenceFinalPunct) {
        Set<Closure> distinct = new LinkedHashSet<>();
        for (int position = 0; position < assignment.size(); position++) {
            distinct.add(assignment.assigned(position));
        }

        List<Closure> ordered = new ArrayList<>(distinct);
        ordered.sort(Comparator.comparingInt(Closure::firstPosition));

        List<Subclause> subclauses = new ArrayList<>(ordered.size());
        for (Closure span : ordered) {
            List<String> surface = new ArrayList<>(span.size());
            for (int position : span.positions()) {
                surface.add(tree.token(position).text());
            }
            List<String> restored = Terminators.restore(surface, sentenceFinalPunct);
            List<String> trimmed = trimmer.trim(restored);
            subclauses.add(new Subclause(Terminators.seal(trimmed, sentenceFinalPunct)));
        }
        return List.copyOf(subclauses);
    }
}
