package com.svdac.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 域赋值规则
 * <p>
 * 例如 {@code DacRule(left="s2", right=["s1","r1"], assign=NONBLOCKING)}：
 * 左侧含 s2 的非阻塞赋值，右侧每个变量都必须含 s1 或 r1。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DacRule {

    public static final String DEFAULT_IGNORE_TAG = "noDAC";

    /** 赋值左侧需要匹配的模式 */
    private String left;

    /** 右侧允许出现的模式（有序） */
    @Builder.Default
    private List<String> right = new ArrayList<>();

    /** 赋值运算符 */
    @Builder.Default
    private AssignOperator assign = AssignOperator.NONBLOCKING;

    /** 行内忽略标记，出现在某行注释中时该行不参与检查 */
    @Builder.Default
    private String ignore = DEFAULT_IGNORE_TAG;

    /** 编译时自动生成，避免 s0 误匹配 s0_c 这类更长的名字 */
    @Builder.Default
    private List<String> exclude = new ArrayList<>();

    public RuleKey key() {
        return new RuleKey(left, assign);
    }

    public boolean hasExclusions() {
        return exclude != null && !exclude.isEmpty();
    }

    /** 形如 "s2 <= [s1, r1]" */
    public String describe() {
        return left + " " + assign.symbol() + " " + right;
    }

    public enum AssignOperator {
        BLOCKING("="), NONBLOCKING("<=");

        private final String symbol;

        AssignOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /** 两侧带空格的形式，与预处理后的语句文本对齐 */
        public String spaced() {
            return " " + symbol + " ";
        }
    }
}
