package com.clausesplit.parse;

import com.clausesplit.tree.DependencyToken;
import com.clausesplit.tree.DependencyTree;
import com.clausesplit.tree.MalformedTreeException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CoNLL-U 格式读取器，每个以空行分隔的句块生成一棵依存树。
 *
 * 注释行、多词区间行（1-2）与空节点（1.1）被跳过；标签取 XPOS，为 "_" 时回退到 UPOS。
 */
public class ConlluReader {
    private static final int MIN_COLUMNS = 8;
    private static final String EMPTY_FIELD = "_";

    public List<DependencyTree> read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<DependencyTree> read(String content) {
        try {
            return read(new StringReader(content == null ? "" : content));
        } catch (IOException exception) {
            throw new UncheckedIOException(exception);
        }
    }

    public List<DependencyTree> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<DependencyTree> sentences = new ArrayList<>();
        List<DependencyToken> block = new ArrayList<>();
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                flush(block, sentences);
                continue;
            }
            if (line.startsWith("#")) {
                continue;
            }
            DependencyToken token = parseLine(line, lineNumber);
            if (token != null) {
                block.add(token);
            }
        }
        flush(block, sentences);
        return List.copyOf(sentences);
    }

    private void flush(List<DependencyToken> block, List<DependencyTree> sentences) {
        if (!block.isEmpty()) {
            sentences.add(DependencyTree.of(block));
            block.clear();
        }
    }

    /**
     * 解析单行词元；多词区间与空节点返回 null。
     */
    private DependencyToken parseLine(String line, int lineNumber) {
        String[] columns = line.split("\t");
        if (columns.length < MIN_COLUMNS) {
            throw new MalformedTreeException("第 " + lineNumber + " 行列数不足: " + columns.length);
        }

        String id = columns[0];
        if (id.contains("-") || id.contains(".")) {
            return null;
        }

        int tokenId = parseInt(id, "ID", lineNumber);
        int headId = parseInt(columns[6], "HEAD", lineNumber);
        String tag = EMPTY_FIELD.equals(columns[4]) ? columns[3] : columns[4];
        int head = headId == 0 ? DependencyToken.NO_HEAD : headId - 1;

        return new DependencyToken(tokenId - 1, columns[1], tag, columns[7], head);
    }

    private int parseInt(String value, String column, int lineNumber) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exception) {
            throw new MalformedTreeException("第 " + lineNumber + " 行 " + column + " 列不是整数: " + value);
        }
    }
}
