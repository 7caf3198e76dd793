package com.svdac.parser;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HDL 源码预处理
 * <p>
 * 去掉注释和宏、给结构符号与关键字两侧补空格。所有替换都保持行数不变，
 * 保证后续语句的行号与原文件一致。
 */
@Component
public class SourcePreprocessor {

    // 嵌套注释这类写法会失效，但足够应付常见代码
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern MACRO = Pattern.compile("`.*");
    private static final Pattern ARRAY_INDEX = Pattern.compile("\\[.*?]");
    private static final Pattern KEYWORD = Pattern.compile(
            "(?<!\\w)(begin|end|if|else|case|casez|casex|endcase|for|endgenerate|endfunction)(?!\\w)");
    private static final Pattern NONBLOCKING_ASSIGN = Pattern.compile("(?<![<=>!])<=(?![<=>])");
    private static final Pattern BLOCKING_ASSIGN = Pattern.compile("(?<![<=>!])=(?![<=>])");

    private static final String CONTINUATION_MARKER = "__killed_macro__";
    private static final List<String> STRUCTURAL_SYMBOLS = List.of("(", ")", ";", ":");

    /**
     * 预处理完整文件内容，返回与输入行数相同的文本
     */
    public String preprocess(String content) {
        String code = normalizeLineEndings(content);
        code = stripComments(code);
        code = stripMacros(code);
        return spaceOut(code);
    }

    /**
     * 去掉行注释与块注释，块注释替换为等量的换行
     */
    String stripComments(String code) {
        String result = LINE_COMMENT.matcher(code).replaceAll("");
        return replacePreservingLines(BLOCK_COMMENT.matcher(result), "\n");
    }

    /**
     * 去掉宏调用（反引号到行尾，含续行），续行替换为等量换行
     */
    String stripMacros(String code) {
        String joined = code.replace("\\\n", CONTINUATION_MARKER);
        Matcher matcher = MACRO.matcher(joined);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int count = countOccurrences(matcher.group(), CONTINUATION_MARKER);
            matcher.appendReplacement(sb, Matcher.quoteReplacement("\n".repeat(count)));
        }
        matcher.appendTail(sb);
        // 不属于宏的续行还原成换行
        return sb.toString().replace(CONTINUATION_MARKER, "\n");
    }

    /**
     * 给结构符号、关键字和赋值运算符两侧补空格，便于按空白切分 token
     */
    String spaceOut(String code) {
        String result = code;
        for (String symbol : STRUCTURAL_SYMBOLS) {
            result = result.replace(symbol, " " + symbol + " ");
        }
        result = KEYWORD.matcher(result).replaceAll(" $1 ");
        result = NONBLOCKING_ASSIGN.matcher(result).replaceAll(" <= ");
        result = BLOCKING_ASSIGN.matcher(result).replaceAll(" = ");
        // 还原 ::
        return result.replace(" :  : ", "::");
    }

    /**
     * 清空带有忽略标记的行；标记后紧跟 ';' 时保留一个 ';' 以维持语法完整
     */
    public String blankIgnoredLines(String content, String ignoreTag) {
        if (ignoreTag == null || ignoreTag.isBlank()) {
            return content;
        }
        String[] lines = normalizeLineEndings(content).split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].contains(ignoreTag)) {
                lines[i] = lines[i].contains(ignoreTag + ";") ? ";" : "";
            }
        }
        return String.join("\n", lines);
    }

    /**
     * 数组下标中的多余空格会干扰变量提取，例如 "a[3 : 0]" 收拢为 "a[3:0]"
     */
    public static String collapseArrayIndices(String text) {
        Matcher matcher = ARRAY_INDEX.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group().replace(" ", "")));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String normalizeLineEndings(String content) {
        return content.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static String replacePreservingLines(Matcher matcher, String unit) {
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int count = countOccurrences(matcher.group(), "\n");
            matcher.appendReplacement(sb, Matcher.quoteReplacement(unit.repeat(count)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = text.indexOf(needle, idx + needle.length());
        }
        return count;
    }
}
