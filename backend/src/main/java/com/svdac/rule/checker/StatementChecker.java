package com.svdac.rule.checker;

import com.svdac.model.DacRule;
import com.svdac.model.FlatStatement;
import com.svdac.model.Violation;

import java.util.List;

/**
 * 语句规则检查器接口
 */
public interface StatementChecker {

    /**
     * 用一条规则检查一条展平后的语句；规则不适用时返回 {@link CheckResult#notApplicable()}
     */
    CheckResult check(FlatStatement statement, DacRule rule, CheckContext context);

    record CheckResult(int passes, List<Violation> violations) {
        public static CheckResult notApplicable() {
            return new CheckResult(0, List.of());
        }
    }
}
