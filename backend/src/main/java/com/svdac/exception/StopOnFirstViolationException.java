package com.svdac.exception;

import com.svdac.model.Violation;

/**
 * 开启"遇到第一个违规即停止"时由检查器抛出，扫描服务负责收尾
 */
public class StopOnFirstViolationException extends RuntimeException {

    private final transient Violation violation;

    public StopOnFirstViolationException(Violation violation) {
        super("遇到第一个违规，停止检查: " + violation.getMessage());
        this.violation = violation;
    }

    public Violation getViolation() {
        return violation;
    }
}
