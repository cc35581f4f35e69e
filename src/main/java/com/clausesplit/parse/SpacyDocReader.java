package com.clausesplit.parse;

import com.clausesplit.tree.DependencyToken;
import com.clausesplit.tree.DependencyTree;
import com.clausesplit.tree.MalformedTreeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取 spaCy {@code Doc.to_json()} 输出。
 *
 * 词元文本按 start/end 从 text 字段截取，根节点满足 head == id。
 * 存在 sents 字段时按句拆分，每句位置重新从 0 编号。
 */
public class SpacyDocReader {

    private final ObjectMapper mapper;

    public SpacyDocReader() {
        this(new ObjectMapper());
    }

    public SpacyDocReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<DependencyTree> read(Path file) throws IOException {
        try (InputStream input = Files.newInputStream(file)) {
            return read(mapper.readTree(input));
        }
    }

    public List<DependencyTree> read(String json) throws IOException {
        return read(mapper.readTree(json));
    }

    private List<DependencyTree> read(JsonNode doc) {
        if (doc == null || !doc.isObject()) {
            throw new MalformedTreeException("spaCy 文档必须是 JSON 对象");
        }
        String text = doc.path("text").asText("");
        JsonNode tokens = doc.path("tokens");
        if (!tokens.isArray() || tokens.isEmpty()) {
            return List.of();
        }

        List<int[]> sentenceRanges = sentenceRanges(doc.path("sents"), text.length());
        List<DependencyTree> trees = new ArrayList<>();
        for (int[] range : sentenceRanges) {
            List<JsonNode> sentenceTokens = new ArrayList<>();
            for (JsonNode token : tokens) {
                int start = token.path("start").asInt();
                if (start >= range[0] && start < range[1]) {
                    sentenceTokens.add(token);
                }
            }
            if (!sentenceTokens.isEmpty()) {
                trees.add(toTree(sentenceTokens, text));
            }
        }
        return List.copyOf(trees);
    }

    private List<int[]> sentenceRanges(JsonNode sents, int textLength) {
        List<int[]> ranges = new ArrayList<>();
        if (sents.isArray()) {
            for (JsonNode sent : sents) {
                ranges.add(new int[] {sent.path("start").asInt(), sent.path("end").asInt()});
            }
        }
        if (ranges.isEmpty()) {
            ranges.add(new int[] {0, Integer.MAX_VALUE});
        }
        return ranges;
    }

    private DependencyTree toTree(List<JsonNode> sentenceTokens, String text) {
        int offset = sentenceTokens.get(0).path("id").asInt();
        List<DependencyToken> tokens = new ArrayList<>(sentenceTokens.size());
        for (JsonNode node : sentenceTokens) {
            if (!node.has("id") || !node.has("head")) {
                throw new MalformedTreeException("spaCy 词元缺少 id 或 head 字段");
            }
            int id = node.get("id").asInt();
            int headId = node.get("head").asInt();
            int head = headId == id ? DependencyToken.NO_HEAD : headId - offset;
            tokens.add(new DependencyToken(
                id - offset,
                surface(node, text),
                tagOf(node),
                node.path("dep").asText(""),
                head
            ));
        }
        return DependencyTree.of(tokens);
    }

    private String tagOf(JsonNode node) {
        String tag = node.path("tag").asText("");
        return tag.isBlank() ? node.path("pos").asText("") : tag;
    }

    private String surface(JsonNode node, String text) {
        if (node.has("text")) {
            return node.get("text").asText();
        }
        int start = node.path("start").asInt();
        int end = node.path("end").asInt();
        if (start < 0 || end > text.length() || start > end) {
            throw new MalformedTreeException("词元偏移越界: " + start + ".." + end, node.path("id").asInt());
        }
        return text.substring(start, end);
    }
}
