package com.svdac.model;

/**
 * 单次扫描的开关
 *
 * @param stopOnFirst 遇到第一个违规即停止
 * @param verbose     输出变量被跳过的原因
 */
public record ScanOptions(boolean stopOnFirst, boolean verbose) {

    public static ScanOptions defaults() {
        return new ScanOptions(false, false);
    }
}
