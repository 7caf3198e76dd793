package com.svdac.service;

import com.svdac.model.DacRule;
import com.svdac.model.Violation;

import java.util.List;

/**
 * 扫描过程中的回调，默认什么都不做
 */
public interface ScanListener {

    ScanListener NONE = new ScanListener() {
    };

    /** 某个文件的规则编译完成 */
    default void rulesCompiled(String fileName, List<DacRule> rules) {
    }

    /** 发现违规，在检查过程中立即触发 */
    default void violationFound(Violation violation) {
    }
}
