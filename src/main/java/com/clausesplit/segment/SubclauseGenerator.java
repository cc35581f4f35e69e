package com.clausesplit.segment;

import com.clausesplit.config.LanguageProfile;
import com.clausesplit.config.LanguageRegistry;
import com.clausesplit.parse.DependencyParser;
import com.clausesplit.tree.DependencyTree;
import com.clausesplit.tree.MalformedTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 面向文本的子句生成器：把归一化后的句子交给外部句法分析器，再对返回的依存树切分。
 */
public class SubclauseGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SubclauseGenerator.class);

    private final LanguageProfile profile;
    private final DependencyParser parser;
    private final SubclauseSegmenter segmenter;

    public SubclauseGenerator(LanguageProfile profile, DependencyParser parser) {
        this.profile = profile;
        this.parser = parser;
        this.segmenter = new SubclauseSegmenter(profile.segmenter());
    }

    /**
     * 按语言代码创建生成器。
     *
     * @throws com.clausesplit.config.UnsupportedLanguageException 语言未注册时抛出
     */
    public static SubclauseGenerator forLanguage(LanguageRegistry registry, String language, DependencyParser parser) {
        LanguageProfile profile = registry.get(language);
        logger.debug("使用语言配置 {} (model={})", profile.language(), profile.parserModel());
        return new SubclauseGenerator(profile, parser);
    }

    public List<Subclause> convertToSubclauses(String normalizedSentence) {
        if (normalizedSentence == null || normalizedSentence.isBlank()) {
            return List.of();
        }
        DependencyTree tree = parser.parse(normalizedSentence.strip());
        if (tree == null) {
            throw new MalformedTreeException("句法分析器未返回依存树");
        }
        return segmenter.segment(tree);
    }

    public LanguageProfile getProfile() {
        return profile;
    }
}
