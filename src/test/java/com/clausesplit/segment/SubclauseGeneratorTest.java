package com.clausesplit.segment;

import com.clausesplit.SentenceFixtures;
import com.clausesplit.config.LanguageRegistry;
import com.clausesplit.config.UnsupportedLanguageException;
import com.clausesplit.parse.DependencyParser;
import com.clausesplit.tree.MalformedTreeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubclauseGeneratorTest {

    private final LanguageRegistry registry = LanguageRegistry.withBuiltIns();

    @Test
    @DisplayName("文本交给分析器后切分")
    void testConvertToSubclauses() {
        List<String> received = new ArrayList<>();
        DependencyParser parser = text -> {
            received.add(text);
            return SentenceFixtures.coordinatedClauses();
        };
        SubclauseGenerator generator = SubclauseGenerator.forLanguage(registry, "en", parser);

        List<Subclause> subclauses = generator.convertToSubclauses("  the service was great , and the food was amazing .  ");

        assertEquals(List.of("the service was great , and the food was amazing ."), received);
        assertEquals(2, subclauses.size());
        assertEquals("en_core_web_sm", generator.getProfile().parserModel());
    }

    @Test
    @DisplayName("土耳其语预设")
    void testTurkishPreset() {
        SubclauseGenerator generator = SubclauseGenerator.forLanguage(
            registry, "tr", text -> SentenceFixtures.turkishCoordination());

        List<Subclause> subclauses = generator.convertToSubclauses("yemek çok iyiydi ve servis de süperdi .");

        assertEquals("yemek çok iyiydi .", subclauses.get(0).text());
        assertEquals("servis de süperdi .", subclauses.get(1).text());
    }

    @Test
    @DisplayName("未注册语言立即失败")
    void testUnsupportedLanguage() {
        DependencyParser parser = text -> SentenceFixtures.singleToken();

        UnsupportedLanguageException exception = assertThrows(UnsupportedLanguageException.class,
            () -> SubclauseGenerator.forLanguage(registry, "de", parser));

        assertEquals("de", exception.getLanguage());
        assertTrue(exception.getSupported().contains("en"));
    }

    @Test
    @DisplayName("空白输入不调用分析器")
    void testBlankInput() {
        SubclauseGenerator generator = SubclauseGenerator.forLanguage(registry, "en", text -> {
            throw new AssertionError("parser should not be called");
        });

        assertTrue(generator.convertToSubclauses("   ").isEmpty());
        assertTrue(generator.convertToSubclauses(null).isEmpty());
    }

    @Test
    @DisplayName("分析器未返回树")
    void testParserReturnsNull() {
        SubclauseGenerator generator = SubclauseGenerator.forLanguage(registry, "en", text -> null);

        assertThrows(MalformedTreeException.class, () -> generator.convertToSubclauses("hello"));
    }
}
