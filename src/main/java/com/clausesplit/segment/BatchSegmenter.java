package com.clausesplit.segment;

import com.clausesplit.config.Constants;
import com.clausesplit.tree.DependencyTree;
import com.clausesplit.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 文档级并行切分：每个句子作为独立任务提交到固定线程池，结果按输入顺序返回。
 */
public class BatchSegmenter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BatchSegmenter.class);

    private final SubclauseSegmenter segmenter;
    private final ExecutorService executor;
    private final int threads;

    public BatchSegmenter(SubclauseSegmenter segmenter) {
        this(segmenter, Constants.DEFAULT_BATCH_THREADS);
    }

    public BatchSegmenter(SubclauseSegmenter segmenter, int threads) {
        this.segmenter = segmenter;
        this.threads = resolveThreadCount(threads);
        this.executor = Executors.newFixedThreadPool(this.threads, new NamedThreadFactory("segmenter", true));
    }

    /**
     * 并行切分全部句子；任一句失败则整批失败，原始异常被重新抛出。
     */
    public List<List<Subclause>> segmentAll(List<DependencyTree> sentences) {
        if (sentences.isEmpty()) {
            return List.of();
        }

        List<Future<List<Subclause>>> futures = new ArrayList<>(sentences.size());
        for (DependencyTree sentence : sentences) {
            futures.add(executor.submit(() -> segmenter.segment(sentence)));
        }

        List<List<Subclause>> results = new ArrayList<>(sentences.size());
        try {
            for (int index = 0; index < futures.size(); index++) {
                results.add(await(futures.get(index), index));
            }
        } catch (RuntimeException exception) {
            futures.forEach(future -> future.cancel(true));
            throw exception;
        }
        logger.debug("批量切分完成: {} 句, {} 线程", sentences.size(), threads);
        return List.copyOf(results);
    }

    private List<Subclause> await(Future<List<Subclause>> future, int index) {
        try {
            return future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("批量切分被中断", exception);
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            logger.error("第 {} 句切分失败: {}", index, cause.getMessage());
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("第 " + index + " 句切分失败", cause);
        }
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("切分线程池未在 5 秒内退出，强制关闭");
                executor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static int resolveThreadCount(int requested) {
        if (requested <= 0) {
            logger.warn("非法线程数 {}，已回退为默认值 {}", requested, Constants.DEFAULT_BATCH_THREADS);
            return Constants.DEFAULT_BATCH_THREADS;
        }
        if (requested > Constants.MAX_BATCH_THREADS) {
            logger.warn("线程数 {} 超过安全上限 {}，已自动限制", requested, Constants.MAX_BATCH_THREADS);
            return Constants.MAX_BATCH_THREADS;
        }
        return requested;
    }
}
