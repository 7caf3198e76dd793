package com.svdac.rule.checker;

import com.svdac.exception.StopOnFirstViolationException;
import com.svdac.model.Violation;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.function.Consumer;

/**
 * 单个文件的检查上下文，文件检查结束后丢弃
 */
@Getter
@Builder
public class CheckContext {

    /** 当前文件名 */
    private final String fileName;

    /** DACexception 声明的例外子串，语句中出现任意一个即跳过 */
    @Builder.Default
    private final List<String> exceptions = List.of();

    /** 输出变量被跳过的原因 */
    private final boolean verbose;

    /** 遇到第一个违规即停止 */
    private final boolean stopOnFirst;

    /** 违规发生时立即通知 */
    @Builder.Default
    private final Consumer<Violation> violationListener = v -> { };

    public boolean isExcepted(String statementText) {
        return exceptions.stream().anyMatch(statementText::contains);
    }

    /**
     * 通知监听者；开启 stopOnFirst 时随后抛出 {@link StopOnFirstViolationException}
     */
    public void report(Violation violation) {
        violationListener.accept(violation);
        if (stopOnFirst) {
            throw new StopOnFirstViolationException(violation);
        }
    }
}
