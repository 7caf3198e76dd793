package com.svdac.service;

import com.svdac.model.DacRule;
import com.svdac.model.Violation;

import java.util.List;

/**
 * 单个文件的检查结果
 *
 * @param fileName     文件名
 * @param rules        该文件使用的规则
 * @param statements   展平后的语句数
 * @param passes       通过的变量检查次数
 * @param violations   违规记录
 * @param stoppedEarly 是否因遇到第一个违规而停止
 */
public record FileCheckResult(
        String fileName,
        List<DacRule> rules,
        int statements,
        int passes,
        List<Violation> violations,
        boolean stoppedEarly) {
}
