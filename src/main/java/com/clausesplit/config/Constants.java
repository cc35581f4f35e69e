package com.clausesplit.config;

import java.util.List;
import java.util.Set;

/**
 * 全局常量定义
 *
 * 包含子句边界规则默认值、终止符集合和批处理线程参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 子句边界规则 ====================
    /** 标记新子句开始的依存关系：并列、从句补语 */
    public static final Set<String> DEFAULT_BOUNDARY_RELATIONS = Set.of("conj", "ccomp");
    /** 可作为子句中心词的谓词标签：动词、过去式、三单现在式、动名词/现在分词 */
    public static final Set<String> DEFAULT_CLAUSE_HEAD_TAGS = Set.of("verb", "vbd", "vbz", "vbg");
    /** 英文子句首尾需裁剪的连词与标点 */
    public static final List<String> ENGLISH_TRIM_TOKENS = List.of(
        "and", "or", "but", "however", "also", "?", "!", ".", ",", ":", ";"
    );

    // ==================== 终止符 ====================
    /** 默认句末终止符 */
    public static final String DEFAULT_TERMINATOR = ".";
    /** 子句末尾视为已终止的标点 */
    public static final Set<String> CLAUSE_TERMINATORS = Set.of(".", "?", "!", ";", ":");
    /** 可作为整句终止符的标点 */
    public static final String SENTENCE_TERMINATOR_CHARS = ".?!";
    /** 封口时从子句尾部剥离的字符 */
    public static final String TRAILING_PUNCTUATION_CHARS = ",;:.?!\"";

    // ==================== 线程参数 ====================
    /** 批处理线程数安全上限 */
    public static final int MAX_BATCH_THREADS = 64;
    /** 默认批处理工作线程数 */
    public static final int DEFAULT_BATCH_THREADS = Math.min(Runtime.getRuntime().availableProcessors(), MAX_BATCH_THREADS);
}
