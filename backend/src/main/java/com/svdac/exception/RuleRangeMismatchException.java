package com.svdac.exception;

/**
 * 内嵌规则左右两侧的数字范围宽度不一致
 */
public class RuleRangeMismatchException extends SvDacException {

    public RuleRangeMismatchException(String declaration, int leftStride, int rightStride) {
        super("内嵌规则的数字范围不匹配 (左侧 " + leftStride + ", 右侧 " + rightStride + "): " + declaration);
    }

    public RuleRangeMismatchException(String message) {
        super(message);
    }
}
