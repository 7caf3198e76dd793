package com.svdac.exception;

/**
 * 分词后括号仍与其他字符粘连，后续匹配全部不可信
 */
public class MalformedTokenException extends SvDacException {

    private final String token;
    private final int lineNumber;

    public MalformedTokenException(String token, int lineNumber) {
        super("分词时未能分离括号: " + token + " (第 " + lineNumber + " 行)");
        this.token = token;
        this.lineNumber = lineNumber;
    }

    public String getToken() {
        return token;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
