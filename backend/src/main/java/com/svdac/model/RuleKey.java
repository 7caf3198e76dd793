package com.svdac.model;

import com.svdac.model.DacRule.AssignOperator;

/**
 * 规则身份：左侧模式 + 赋值运算符
 * <p>
 * 仅在编译内嵌规则时用于"后声明覆盖先声明"。
 */
public record RuleKey(String left, AssignOperator assign) {
}
