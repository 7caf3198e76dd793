package com.svdac.model;

/**
 * 分词结果：token 文本 + 所在源文件行号（从 1 开始）
 */
public record SourceToken(String text, int lineNumber) {

    public boolean is(String keyword) {
        return text.equals(keyword);
    }

    @Override
    public String toString() {
        return text;
    }
}
