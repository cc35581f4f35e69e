package com.clausesplit.segment;

import com.clausesplit.config.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BoundaryTrimmerTest {

    private final BoundaryTrimmer trimmer = new BoundaryTrimmer(Constants.ENGLISH_TRIM_TOKENS);

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "and the food was good .|the food was good",
        "but , it was cold|it was cold",
        "the service was great , and .|the service was great",
        "however the view|the view",
        "the bed was comfy|the bed was comfy",
        "and|and",
        ", .|.",
        "and ,|,"
    })
    @DisplayName("首尾连词与标点被裁剪")
    void testTrim(String input, String expected) {
        assertEquals(tokens(expected), trimmer.trim(tokens(input)));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "and the food was good .",
        "but , it was cold",
        ", .",
        "and ,",
        "or",
        "the view , and"
    })
    @DisplayName("裁剪幂等")
    void testTrimIsIdempotent(String input) {
        List<String> once = trimmer.trim(tokens(input));

        assertEquals(once, trimmer.trim(once));
    }

    @Test
    @DisplayName("结果不会为空")
    void testNeverEmpty() {
        assertEquals(List.of(","), trimmer.trim(List.of("and", ",", ";")));
        assertEquals(List.of(), trimmer.trim(List.of()));
    }

    @Test
    @DisplayName("土耳其语连词")
    void testTurkishTrimTokens() {
        BoundaryTrimmer turkish = new BoundaryTrimmer(List.of("ve", "veya", "ama", ",", "."));

        assertEquals(List.of("servis", "de", "süperdi"), turkish.trim(List.of("ve", "servis", "de", "süperdi", ".")));
    }

    private List<String> tokens(String text) {
        return Arrays.asList(text.split(" "));
    }
}
