package com.svdac.model;

import java.util.List;

/**
 * 带行号的文本片段
 * <p>
 * 拼接与拆分都沿用最早片段的行号，不会重新计算。
 * 空片段的行号为 0，第一次追加 token 时才确定行号。
 */
public record LineText(String text, int lineNumber) {

    private static final LineText EMPTY = new LineText("", 0);

    public static LineText empty() {
        return EMPTY;
    }

    public static LineText of(SourceToken token) {
        return new LineText(token.text(), token.lineNumber());
    }

    /**
     * 追加一个 token，并在其后补一个空格
     */
    public LineText append(SourceToken token) {
        if (text.isEmpty()) {
            return new LineText(token.text() + " ", token.lineNumber());
        }
        return new LineText(text + token.text() + " ", lineNumber);
    }

    /**
     * 追加另一个片段；当前为空时继承对方的行号
     */
    public LineText append(LineText other) {
        if (text.isEmpty()) {
            return other;
        }
        return new LineText(text + other.text(), lineNumber);
    }

    public LineText append(String suffix) {
        return new LineText(text + suffix, lineNumber);
    }

    public LineText withText(String newText) {
        return new LineText(newText, lineNumber);
    }

    /**
     * 在分隔符第一次出现处拆成两段；未出现时只返回自身
     */
    public List<LineText> splitFirst(String separator) {
        int idx = text.indexOf(separator);
        if (idx < 0) {
            return List.of(this);
        }
        return List.of(withText(text.substring(0, idx)),
                withText(text.substring(idx + separator.length())));
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return text;
    }
}
