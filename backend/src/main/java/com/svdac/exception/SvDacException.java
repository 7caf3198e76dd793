package com.svdac.exception;

/**
 * 检查过程中无法继续的致命错误
 */
public class SvDacException extends RuntimeException {

    public SvDacException(String message) {
        super(message);
    }

    public SvDacException(String message, Throwable cause) {
        super(message, cause);
    }
}
