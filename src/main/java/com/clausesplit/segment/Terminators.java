package com.clausesplit.segment;

import com.clausesplit.config.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 句末终止符的检测与补全。
 */
public final class Terminators {

    private static final Pattern SENTENCE_FINAL = Pattern.compile(
        "([" + Constants.SENTENCE_TERMINATOR_CHARS + "])[\"']*$");

    private Terminators() {
    }

    /**
     * 只认单个终止符词元，"?!" 之类的组合不算；封口步骤会统一改写末尾标点。
     */
    public static boolean isClauseTerminator(String token) {
        return token != null && Constants.CLAUSE_TERMINATORS.contains(token);
    }

    /**
     * 检测整句的终止符：连接后的文本以 . ? ! 结尾（允许其后紧跟引号），否则返回默认值。
     */
    public static String sentenceFinal(List<String> tokens, String defaultTerminator) {
        Matcher matcher = SENTENCE_FINAL.matcher(String.join(" ", tokens).strip());
        return matcher.find() ? matcher.group(1) : defaultTerminator;
    }

    /**
     * 末词不是子句终止符时追加 terminator。
     */
    public static List<String> restore(List<String> tokens, String terminator) {
        List<String> restored = new ArrayList<>(tokens);
        if (restored.isEmpty() || !isClauseTerminator(restored.get(restored.size() - 1))) {
            restored.add(terminator);
        }
        return restored;
    }

    /**
     * 剥离尾部的 , ; : . ? ! " 字符后统一追加整句终止符。
     * 按词元逐个剥离：全由这些字符组成的尾部词元会被整个移除，直到遇到含其他字符的词元。
     */
    public static List<String> seal(List<String> tokens, String terminator) {
        List<String> sealed = new ArrayList<>(tokens);
        while (!sealed.isEmpty()) {
            int last = sealed.size() - 1;
            String stripped = stripTrailingPunctuation(sealed.get(last));
            if (!stripped.isEmpty()) {
                sealed.set(last, stripped);
                break;
            }
            sealed.remove(last);
        }
        sealed.add(terminator);
        return sealed;
    }

    private static String stripTrailingPunctuation(String token) {
        int end = token.length();
        while (end > 0 && Constants.TRAILING_PUNCTUATION_CHARS.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(0, end);
    }
}
