package com.clausesplit;

import com.clausesplit.segment.BatchSegmenter;
import com.clausesplit.segment.Subclause;
import com.clausesplit.segment.SubclauseSegmenter;
import com.clausesplit.tree.DependencyToken;
import com.clausesplit.tree.DependencyTree;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 子句切分性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class SegmenterBenchmark {

    @State(Scope.Benchmark)
    public static class SentenceState {
        @Param({"10", "50", "200"})
        int clauses;

        SubclauseSegmenter segmenter;
        DependencyTree sentence;

        @Setup
        public void setup() {
            segmenter = new SubclauseSegmenter();
            sentence = generateSentence(clauses);
        }
    }

    @State(Scope.Benchmark)
    public static class DocumentState {
        SubclauseSegmenter segmenter;
        BatchSegmenter batch;
        List<DependencyTree> sentences;

        @Setup
        public void setup() {
            segmenter = new SubclauseSegmenter();
            batch = new BatchSegmenter(segmenter, 4);
            // 生成1000个句子
            sentences = new ArrayList<>();
            for (int i = 0; i < 1000; i++) {
                sentences.add(generateSentence(1 + i % 5));
            }
        }

        @TearDown
        public void tearDown() {
            if (batch != null) {
                batch.close();
            }
        }
    }

    /**
     * 生成由 "the nN was good ," 串联而成的并列句，每段以 conj 挂在前一段的动词上。
     */
    static DependencyTree generateSentence(int clauses) {
        List<DependencyToken> tokens = new ArrayList<>();
        int previousVerb = DependencyToken.NO_HEAD;
        for (int clause = 0; clause < clauses; clause++) {
            int base = tokens.size();
            int verb = base + 2;
            tokens.add(new DependencyToken(base, "the", "DT", "det", base + 1));
            tokens.add(new DependencyToken(base + 1, "n" + clause, "NN", "nsubj", verb));
            tokens.add(new DependencyToken(verb, "was", "VBD", clause == 0 ? "ROOT" : "conj", previousVerb));
            tokens.add(new DependencyToken(base + 3, "good", "JJ", "acomp", verb));
            tokens.add(new DependencyToken(base + 4, clause == 0 ? "," : "and", clause == 0 ? "," : "CC", "cc", verb));
            previousVerb = verb;
        }
        tokens.add(new DependencyToken(tokens.size(), ".", ".", "punct", 2));
        return DependencyTree.of(tokens);
    }

    @Benchmark
    public List<Subclause> segmentSentence(SentenceState state) {
        return state.segmenter.segment(state.sentence);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int segmentDocumentSequential(DocumentState state) {
        int total = 0;
        for (DependencyTree sentence : state.sentences) {
            total += state.segmenter.segment(sentence).size();
        }
        return total;
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int segmentDocumentParallel(DocumentState state) {
        return state.batch.segmentAll(state.sentences).size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(SegmenterBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
