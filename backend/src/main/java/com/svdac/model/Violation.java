package com.svdac.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条违规记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Violation {

    /** 违反的规则 */
    private DacRule rule;

    /** 所在文件 */
    private String fileName;

    /** 语句起始行号 */
    private int lineNumber;

    /** 违规的右侧变量 */
    private String operand;

    /** 展平后的语句（含条件标注） */
    private String statement;

    /** 违规描述 */
    private String message;
}
