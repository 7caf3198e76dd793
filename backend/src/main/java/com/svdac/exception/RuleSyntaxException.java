package com.svdac.exception;

/**
 * 内嵌规则无法解析
 */
public class RuleSyntaxException extends SvDacException {

    public RuleSyntaxException(String message) {
        super(message);
    }

    public RuleSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
