package com.svdac.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 展平后的单条语句
 *
 * @param code       语句本体（不含条件标注）
 * @param lineNumber 语句第一个 token 所在行
 * @param conditions 外层条件，内层在前
 */
public record FlatStatement(String code, int lineNumber, List<ConditionTag> conditions) {

    public FlatStatement {
        conditions = List.copyOf(conditions);
    }

    public static FlatStatement of(LineText line) {
        return new FlatStatement(line.text().trim(), line.lineNumber(), Collections.emptyList());
    }

    public FlatStatement withCondition(ConditionTag tag) {
        List<ConditionTag> tags = new ArrayList<>(conditions);
        tags.add(tag);
        return new FlatStatement(code, lineNumber, tags);
    }

    /**
     * 语句本体加上全部条件标注，例如 "q_s1 <= d_s0 ; :if: (en)"
     */
    public String text() {
        StringBuilder sb = new StringBuilder(code);
        for (ConditionTag tag : conditions) {
            sb.append(tag.render());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return lineNumber + ": " + text();
    }
}
