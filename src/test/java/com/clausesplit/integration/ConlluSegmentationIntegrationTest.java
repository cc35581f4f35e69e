package com.clausesplit.integration;

import com.clausesplit.config.LanguageRegistry;
import com.clausesplit.parse.ConlluReader;
import com.clausesplit.segment.BatchSegmenter;
import com.clausesplit.segment.Subclause;
import com.clausesplit.segment.SubclauseSegmenter;
import com.clausesplit.tree.DependencyTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ConlluSegmentationIntegrationTest {

    @Test
    @DisplayName("CoNLL-U 语料端到端切分")
    void testSegmentFixtureCorpus() throws IOException {
        List<DependencyTree> sentences = readFixture();
        LanguageRegistry registry = LanguageRegistry.withBuiltIns();
        SubclauseSegmenter english = new SubclauseSegmenter(registry.get("en").segmenter());
        SubclauseSegmenter turkish = new SubclauseSegmenter(registry.get("tr").segmenter());

        assertEquals(3, sentences.size());
        assertEquals(List.of("the service was great .", "the food was amazing ."), texts(english.segment(sentences.get(0))));
        assertEquals(List.of("i think .", "the pizza is overpriced ."), texts(english.segment(sentences.get(1))));
        assertEquals(List.of("yemek çok iyiydi .", "servis de süperdi ."), texts(turkish.segment(sentences.get(2))));
    }

    @Test
    @DisplayName("批量切分语料")
    void testBatchOverFixtureCorpus() throws IOException {
        List<DependencyTree> sentences = readFixture();
        SubclauseSegmenter segmenter = new SubclauseSegmenter();

        try (BatchSegmenter batch = new BatchSegmenter(segmenter, 2)) {
            List<List<Subclause>> results = batch.segmentAll(sentences);

            assertEquals(3, results.size());
            assertEquals(2, results.get(0).size());
            assertEquals("ve servis de süperdi .", results.get(2).get(1).text());
        }
    }

    private List<DependencyTree> readFixture() throws IOException {
        InputStream input = getClass().getClassLoader().getResourceAsStream("fixtures/reviews.conllu");
        assertNotNull(input);
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            return new ConlluReader().read(reader);
        }
    }

    private List<String> texts(List<Subclause> subclauses) {
        return subclauses.stream().map(Subclause::text).toList();
    }
}
