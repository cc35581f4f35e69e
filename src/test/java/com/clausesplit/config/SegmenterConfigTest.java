package com.clausesplit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SegmenterConfigTest {

    @Test
    void testDefaults() {
        SegmenterConfig config = SegmenterConfig.defaults();

        assertEquals(Constants.DEFAULT_BOUNDARY_RELATIONS, config.boundaryRelations());
        assertEquals(Constants.DEFAULT_CLAUSE_HEAD_TAGS, config.clauseHeadTags());
        assertEquals(Constants.ENGLISH_TRIM_TOKENS, config.boundaryTrimTokens());
        assertEquals(Constants.DEFAULT_TERMINATOR, config.defaultTerminator());
    }

    @Test
    void testWithers() {
        SegmenterConfig config = SegmenterConfig.defaults()
            .withBoundaryRelations(Set.of("conj", "advcl"))
            .withClauseHeadTags(Set.of("VB"))
            .withBoundaryTrimTokens(List.of("ve", ","))
            .withDefaultTerminator("!");

        assertEquals(Set.of("conj", "advcl"), config.boundaryRelations());
        assertEquals(Set.of("vb"), config.clauseHeadTags());
        assertEquals(List.of("ve", ","), config.boundaryTrimTokens());
        assertEquals("!", config.defaultTerminator());
        assertEquals(Constants.DEFAULT_BOUNDARY_RELATIONS, SegmenterConfig.defaults().boundaryRelations());
    }

    @Test
    void testIsBoundaryRequiresRelationAndTag() {
        SegmenterConfig config = SegmenterConfig.defaults();

        assertTrue(config.isBoundary("conj", "VBD"));
        assertTrue(config.isBoundary("CCOMP", "vbz"));
        assertFalse(config.isBoundary("conj", "NN"));
        assertFalse(config.isBoundary("advcl", "VBD"));
        assertFalse(config.isBoundary(null, null));
    }

    @Test
    void testBlankTerminatorFallsBack() {
        assertEquals(".", SegmenterConfig.defaults().withDefaultTerminator(" ").defaultTerminator());
    }

    @Test
    void testJsonMissingFieldsUseDefaults() throws IOException {
        SegmenterConfig config = new ObjectMapper().readValue(
            "{\"boundaryRelations\": [\"CONJ\", \"parataxis\"]}", SegmenterConfig.class);

        assertEquals(Set.of("conj", "parataxis"), config.boundaryRelations());
        assertEquals(Constants.DEFAULT_CLAUSE_HEAD_TAGS, config.clauseHeadTags());
        assertEquals(Constants.DEFAULT_TERMINATOR, config.defaultTerminator());
    }
}
