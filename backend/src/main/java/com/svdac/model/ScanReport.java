package com.svdac.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 扫描结果报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanReport {

    /** 扫描的目录或文件 */
    private String repoPath;

    /** 扫描时间 */
    private LocalDateTime scanTime;

    /** 扫描的文件总数 */
    private int totalFiles;

    /** 展平后的语句总数 */
    private int totalStatements;

    /** 通过的变量检查次数 */
    private int totalPasses;

    /** 违规总数 */
    private int totalViolations;

    /** 违规记录（超过上限时截断） */
    private List<Violation> violations;

    /** 扫描的文件列表 */
    private List<String> scannedFiles;

    /** 提示信息（跳过的文件、编码回退等） */
    private List<String> notices;

    /** 是否因为违规过多达上限而截断 */
    private boolean limitReached;

    /** 是否因"遇到第一个违规即停止"而提前结束 */
    private boolean stoppedEarly;
}
